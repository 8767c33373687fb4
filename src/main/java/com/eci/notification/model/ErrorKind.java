package com.eci.notification.model;

/**
 * Classified failure kinds. The engine's retry decision depends only on
 * these values, never on transport-specific exceptions.
 */
public enum ErrorKind {
    /** Malformed event or request. Rejected, never retried. */
    VALIDATION_ERROR,
    TEMPLATE_NOT_FOUND,
    MISSING_VARIABLE,
    /** Transient provider or network failure, including timeouts. */
    RETRYABLE_FAILURE,
    /** Provider rejected the message (bad recipient, content refused). */
    PERMANENT_FAILURE,
    EXHAUSTED_RETRIES,
    /** Another job already delivered the same dedup key. */
    DUPLICATE,
    STORE_UNAVAILABLE;

    public boolean isRetryable() {
        return this == RETRYABLE_FAILURE;
    }
}
