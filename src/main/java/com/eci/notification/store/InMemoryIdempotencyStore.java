package com.eci.notification.store;

import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.error.StoreUnavailableException;
import com.eci.notification.model.IdempotencyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Process-local {@link IdempotencyStore}. Atomicity comes from
 * {@link ConcurrentMap#compute}, so it is only correct while a single
 * service instance owns the keys.
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryIdempotencyStore.class);

    private final ConcurrentMap<String, IdempotencyRecord> records = new ConcurrentHashMap<>();
    private final Clock    clock;
    private final Duration deliveredRetention;
    private final Duration inFlightLease;
    private volatile boolean closed;

    public InMemoryIdempotencyStore(final DispatcherConfig config, final Clock clock) {
        this(clock, config.getDeliveredRetention(), config.getInFlightLease());
    }

    public InMemoryIdempotencyStore(
            final Clock clock,
            final Duration deliveredRetention,
            final Duration inFlightLease) {
        this.clock              = clock;
        this.deliveredRetention = deliveredRetention;
        this.inFlightLease      = inFlightLease;
    }

    @Override
    public Reservation checkAndReserve(final String dedupKey, final String jobId) {
        ensureOpen();
        final Instant now = clock.instant();
        final boolean[] leased = {false};
        final IdempotencyRecord holder = records.compute(dedupKey, (k, existing) -> {
            if (existing == null || existing.isExpired(now)) {
                if (existing != null && !existing.isDelivered()) {
                    LOG.warn("Taking over expired lease on {} from job {}", k, existing.getJobId());
                }
                leased[0] = true;
                return lease(k, jobId, now);
            }
            return existing;
        });

        if (leased[0])            return Reservation.fresh(jobId);
        if (holder.isDelivered()) return Reservation.delivered(holder.getJobId());
        return Reservation.inFlight(holder.getJobId());
    }

    @Override
    public void markDelivered(final String dedupKey, final String jobId) {
        ensureOpen();
        final Instant expiresAt = clock.instant().plus(deliveredRetention);
        records.put(dedupKey,
                new IdempotencyRecord(dedupKey, jobId, IdempotencyRecord.Status.DELIVERED, expiresAt));
    }

    @Override
    public void release(final String dedupKey, final String jobId) {
        ensureOpen();
        records.computeIfPresent(dedupKey, (k, existing) ->
                !existing.isDelivered() && existing.getJobId().equals(jobId) ? null : existing);
    }

    @Override
    public Optional<IdempotencyRecord> find(final String dedupKey) {
        ensureOpen();
        final IdempotencyRecord record = records.get(dedupKey);
        if (record == null || record.isExpired(clock.instant())) {
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public int purgeExpired() {
        ensureOpen();
        final Instant now = clock.instant();
        final AtomicInteger removed = new AtomicInteger();
        records.forEach((key, record) -> {
            if (record.isExpired(now) && records.remove(key, record)) {
                removed.incrementAndGet();
            }
        });
        if (removed.get() > 0) {
            LOG.debug("Purged {} expired idempotency records", removed.get());
        }
        return removed.get();
    }

    @Override
    public boolean isAvailable() {
        return !closed;
    }

    @Override
    public void close() {
        closed = true;
        LOG.info("Idempotency store closed ({} records)", records.size());
    }

    private IdempotencyRecord lease(final String key, final String jobId, final Instant now) {
        return new IdempotencyRecord(key, jobId, IdempotencyRecord.Status.IN_FLIGHT, now.plus(inFlightLease));
    }

    private void ensureOpen() {
        if (closed) throw new StoreUnavailableException("Idempotency store is closed");
    }
}
