package com.eci.notification.store;

import com.eci.notification.error.StoreUnavailableException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.DeliveryAttempt;
import com.eci.notification.model.JobState;
import com.eci.notification.model.NotificationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Process-local {@link NotificationStateStore}. Every operation holds the
 * store monitor, which makes the compound operations ({@link #createIfAbsent},
 * {@link #recordAttempt}) atomic.
 */
public class InMemoryNotificationStateStore implements NotificationStateStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryNotificationStateStore.class);

    private static final Comparator<NotificationJob> NEWEST_FIRST =
            Comparator.comparing(NotificationJob::getCreatedAt).reversed()
                      .thenComparing(NotificationJob::getJobId);

    private final Map<String, NotificationJob>       jobs        = new HashMap<>();
    private final Map<String, List<DeliveryAttempt>> attempts    = new HashMap<>();
    private final Map<String, String>                activeByKey = new HashMap<>();
    private final Map<String, String>                latestByKey = new HashMap<>();
    private boolean closed;

    @Override
    public synchronized NotificationJob createIfAbsent(final NotificationJob job) {
        ensureOpen();
        final String activeId = activeByKey.get(job.getDedupKey());
        if (activeId != null) {
            return jobs.get(activeId);
        }
        if (jobs.containsKey(job.getJobId())) {
            throw new IllegalStateException("Job " + job.getJobId() + " already exists");
        }
        jobs.put(job.getJobId(), job);
        attempts.put(job.getJobId(), new ArrayList<>());
        latestByKey.put(job.getDedupKey(), job.getJobId());
        if (!job.isTerminal()) {
            activeByKey.put(job.getDedupKey(), job.getJobId());
        }
        return job;
    }

    @Override
    public synchronized Optional<NotificationJob> findById(final String jobId) {
        ensureOpen();
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized Optional<NotificationJob> findActiveByDedupKey(final String dedupKey) {
        ensureOpen();
        return Optional.ofNullable(activeByKey.get(dedupKey)).map(jobs::get);
    }

    @Override
    public synchronized Optional<NotificationJob> findLatestByDedupKey(final String dedupKey) {
        ensureOpen();
        return Optional.ofNullable(latestByKey.get(dedupKey)).map(jobs::get);
    }

    @Override
    public synchronized NotificationJob update(final NotificationJob job) {
        ensureOpen();
        final NotificationJob stored = requireMutable(job);
        if (stored.getAttemptCount() != job.getAttemptCount()) {
            throw new IllegalStateException(
                    "Attempt count of job " + job.getJobId() + " changes only through recordAttempt");
        }
        store(job);
        return job;
    }

    @Override
    public synchronized NotificationJob recordAttempt(final NotificationJob job, final DeliveryAttempt attempt) {
        ensureOpen();
        requireMutable(job);
        final List<DeliveryAttempt> rows = attempts.get(job.getJobId());
        final int expected = rows.size() + 1;
        if (attempt.getAttemptNo() != expected || job.getAttemptCount() != expected) {
            throw new IllegalStateException("Job " + job.getJobId() + " expects attempt #" + expected
                    + " but got attempt #" + attempt.getAttemptNo() + " with count " + job.getAttemptCount());
        }
        rows.add(attempt);
        store(job);
        return job;
    }

    @Override
    public synchronized List<DeliveryAttempt> findAttempts(final String jobId) {
        ensureOpen();
        return List.copyOf(attempts.getOrDefault(jobId, List.of()));
    }

    @Override
    public synchronized List<NotificationJob> findDueForRetry(final Instant now, final int limit) {
        ensureOpen();
        return jobs.values().stream()
                .filter(j -> j.getState() == JobState.RETRYING)
                .filter(j -> j.getNextRetryAt() == null || !j.getNextRetryAt().isAfter(now))
                .sorted(Comparator.comparing(NotificationJob::getNextRetryAt,
                        Comparator.nullsFirst(Comparator.<Instant>naturalOrder())))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<NotificationJob> findStale(final Instant updatedBefore, final int limit) {
        ensureOpen();
        return jobs.values().stream()
                .filter(j -> j.getState() == JobState.PENDING
                          || j.getState() == JobState.RENDERING
                          || j.getState() == JobState.SENDING)
                .filter(j -> j.getUpdatedAt().isBefore(updatedBefore))
                .sorted(Comparator.comparing(NotificationJob::getUpdatedAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<NotificationJob> query(final JobQuery query) {
        ensureOpen();
        return jobs.values().stream()
                .filter(query::matches)
                .sorted(NEWEST_FIRST)
                .skip(query.offset())
                .limit(query.limit())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized JobStats stats() {
        ensureOpen();
        final Map<JobState, Long> byState   = new EnumMap<>(JobState.class);
        final Map<Channel, Long>  byChannel = new EnumMap<>(Channel.class);
        final Map<String, Long>   byType    = new TreeMap<>();
        for (final JobState state : JobState.values()) byState.put(state, 0L);
        for (final NotificationJob job : jobs.values()) {
            byState.merge(job.getState(), 1L, Long::sum);
            byChannel.merge(job.getChannel(), 1L, Long::sum);
            if (job.getEventType() != null) byType.merge(job.getEventType(), 1L, Long::sum);
        }
        return new JobStats(jobs.size(), byState, byChannel, byType);
    }

    @Override
    public synchronized boolean isAvailable() {
        return !closed;
    }

    @Override
    public synchronized void close() {
        closed = true;
        LOG.info("State store closed ({} jobs)", jobs.size());
    }

    private NotificationJob requireMutable(final NotificationJob job) {
        final NotificationJob stored = jobs.get(job.getJobId());
        if (stored == null) {
            throw new IllegalStateException("Unknown job " + job.getJobId());
        }
        if (stored.isTerminal()) {
            throw new IllegalStateException(
                    "Job " + job.getJobId() + " is " + stored.getState() + " and cannot change");
        }
        return stored;
    }

    private void store(final NotificationJob job) {
        jobs.put(job.getJobId(), job);
        if (job.isTerminal()) {
            activeByKey.remove(job.getDedupKey(), job.getJobId());
        }
    }

    private void ensureOpen() {
        if (closed) throw new StoreUnavailableException("State store is closed");
    }
}
