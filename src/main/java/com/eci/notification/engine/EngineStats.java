package com.eci.notification.engine;

/**
 * Counters since process start.
 */
public record EngineStats(
        long received,
        long accepted,
        long duplicates,
        long rejected,
        long delivered,
        long retried,
        long failed) { }
