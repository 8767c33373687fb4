package com.eci.notification.store;

import com.eci.notification.model.IdempotencyRecord;

import java.util.Optional;

/**
 * Durable dedup key to outcome mapping preventing duplicate delivery of the
 * same logical notification.
 *
 * <p>Implementations must make {@link #checkAndReserve} atomic across every
 * worker and process sharing the store: two concurrent callers for the same
 * key must never both get {@link Reservation.Status#FRESH}. All methods may
 * throw {@link com.eci.notification.error.StoreUnavailableException}.
 */
public interface IdempotencyStore extends AutoCloseable {

    /**
     * Reserve {@code dedupKey} for {@code jobId}, or report who holds it.
     * An expired in-flight lease is taken over; an expired delivered record
     * no longer blocks the key.
     */
    Reservation checkAndReserve(String dedupKey, String jobId);

    /** Record a successful delivery, replacing the caller's lease. */
    void markDelivered(String dedupKey, String jobId);

    /**
     * Drop the caller's in-flight lease so the key can be reserved again.
     * Delivered records and leases held by other jobs are left untouched.
     */
    void release(String dedupKey, String jobId);

    /** The live record for {@code dedupKey}, ignoring expired ones. */
    Optional<IdempotencyRecord> find(String dedupKey);

    /** Remove expired records. Returns how many were removed. */
    int purgeExpired();

    boolean isAvailable();

    @Override
    void close();
}
