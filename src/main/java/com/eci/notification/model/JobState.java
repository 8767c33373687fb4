package com.eci.notification.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a {@link NotificationJob}.
 *
 * <pre>
 *   PENDING ──► RENDERING ──► SENDING ──► DELIVERED
 *      │            │            │
 *      │            │            ├──► RETRYING ──► SENDING / RENDERING
 *      │            │            │        │
 *      └────────────┴────────────┴────────┴──► FAILED
 * </pre>
 *
 * {@code DELIVERED} and {@code FAILED} are terminal. A job stuck in
 * {@code RENDERING} or {@code SENDING} after a crash is recovered to
 * {@code RETRYING}.
 */
public enum JobState {
    PENDING,
    RENDERING,
    SENDING,
    RETRYING,
    DELIVERED,
    FAILED;

    public boolean isTerminal() {
        return this == DELIVERED || this == FAILED;
    }

    public boolean canTransitionTo(final JobState next) {
        return allowedNext().contains(next);
    }

    private Set<JobState> allowedNext() {
        return switch (this) {
            case PENDING   -> EnumSet.of(RENDERING, FAILED);
            case RENDERING -> EnumSet.of(SENDING, RETRYING, FAILED);
            case SENDING   -> EnumSet.of(DELIVERED, RETRYING, FAILED);
            case RETRYING  -> EnumSet.of(RENDERING, SENDING, DELIVERED, FAILED);
            case DELIVERED, FAILED -> EnumSet.noneOf(JobState.class);
        };
    }
}
