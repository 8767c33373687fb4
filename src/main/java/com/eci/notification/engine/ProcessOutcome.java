package com.eci.notification.engine;

/**
 * What a single {@link DispatchEngine#processJob} call did.
 */
public enum ProcessOutcome {
    DELIVERED,
    RETRY_SCHEDULED,
    FAILED,
    /** Job was already delivered or failed. */
    SKIPPED_TERMINAL,
    /** Retry time not reached yet. */
    SKIPPED_NOT_DUE,
    /** Another worker holds the job or its dedup key. */
    SKIPPED_IN_FLIGHT,
    NOT_FOUND
}
