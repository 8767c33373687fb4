package com.eci.notification.store;

import com.eci.notification.model.Channel;
import com.eci.notification.model.JobState;

import java.util.Map;

/**
 * Aggregate job counts for the management stats endpoint.
 */
public record JobStats(
        long total,
        Map<JobState, Long> byState,
        Map<Channel, Long> byChannel,
        Map<String, Long> byEventType) {

    public long count(final JobState state) {
        return byState.getOrDefault(state, 0L);
    }
}
