package com.eci.notification.store;

import com.eci.notification.model.DeliveryAttempt;
import com.eci.notification.model.NotificationJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of every notification job and its append-only delivery
 * attempts.
 *
 * <p>All methods may throw
 * {@link com.eci.notification.error.StoreUnavailableException}.
 */
public interface NotificationStateStore extends AutoCloseable {

    /**
     * Store {@code job} unless a non-terminal job with the same dedup key
     * exists, atomically. Returns the stored job, which is the existing one
     * when the key was taken.
     */
    NotificationJob createIfAbsent(NotificationJob job);

    Optional<NotificationJob> findById(String jobId);

    /** The non-terminal job for {@code dedupKey}, if any. */
    Optional<NotificationJob> findActiveByDedupKey(String dedupKey);

    /** Most recent job for {@code dedupKey} in any state. */
    Optional<NotificationJob> findLatestByDedupKey(String dedupKey);

    /**
     * Replace the stored job.
     *
     * @throws IllegalStateException if the stored job is terminal, or the
     *         update changes the attempt count (use {@link #recordAttempt})
     */
    NotificationJob update(NotificationJob job);

    /**
     * Append {@code attempt} and store {@code job} in one step. The job's
     * attempt count must equal the number of attempts after the append.
     */
    NotificationJob recordAttempt(NotificationJob job, DeliveryAttempt attempt);

    List<DeliveryAttempt> findAttempts(String jobId);

    /** Jobs in {@code RETRYING} whose next retry time is at or before {@code now}. */
    List<NotificationJob> findDueForRetry(Instant now, int limit);

    /** Non-terminal, non-retrying jobs not updated since {@code updatedBefore}. */
    List<NotificationJob> findStale(Instant updatedBefore, int limit);

    List<NotificationJob> query(JobQuery query);

    JobStats stats();

    boolean isAvailable();

    @Override
    void close();
}
