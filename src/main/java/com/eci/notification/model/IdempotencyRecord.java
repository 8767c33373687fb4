package com.eci.notification.model;

import java.time.Instant;

/**
 * Dedup key to outcome mapping held by the
 * {@link com.eci.notification.store.IdempotencyStore}.
 *
 * <p>{@code IN_FLIGHT} records are leases held by the worker currently
 * sending the job; {@code DELIVERED} records are kept for the retention
 * window and block any further delivery for the key.
 */
public final class IdempotencyRecord {

    public enum Status { IN_FLIGHT, DELIVERED }

    private final String  dedupKey;
    private final String  jobId;
    private final Status  status;
    private final Instant expiresAt;

    public IdempotencyRecord(
            final String dedupKey,
            final String jobId,
            final Status status,
            final Instant expiresAt) {
        this.dedupKey  = dedupKey;
        this.jobId     = jobId;
        this.status    = status;
        this.expiresAt = expiresAt;
    }

    public String  getDedupKey()  { return dedupKey; }
    public String  getJobId()     { return jobId; }
    public Status  getStatus()    { return status; }
    public Instant getExpiresAt() { return expiresAt; }

    public boolean isExpired(final Instant now) {
        return !expiresAt.isAfter(now);
    }

    public boolean isDelivered() {
        return status == Status.DELIVERED;
    }

    @Override
    public String toString() {
        return "IdempotencyRecord{key=" + dedupKey
             + ", job=" + jobId
             + ", status=" + status
             + ", expiresAt=" + expiresAt + "}";
    }
}
