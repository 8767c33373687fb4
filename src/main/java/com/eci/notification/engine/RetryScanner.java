package com.eci.notification.engine;

import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.store.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically re-queues due retries, recovers stale jobs and purges
 * expired idempotency records, on a single scheduler thread.
 */
public class RetryScanner implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(RetryScanner.class);

    private final DispatchEngine           engine;
    private final IdempotencyStore         idempotency;
    private final Clock                    clock;
    private final Duration                 scanInterval;
    private final Duration                 purgeInterval;
    private final ScheduledExecutorService scheduler;

    public RetryScanner(
            final DispatchEngine engine,
            final IdempotencyStore idempotency,
            final DispatcherConfig config,
            final Clock clock) {
        this.engine        = engine;
        this.idempotency   = idempotency;
        this.clock         = clock;
        this.scanInterval  = config.getRetryScanInterval();
        this.purgeInterval = config.getIdempotencyPurgeInterval();
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            final Thread t = new Thread(r, "retry-scanner");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::scan,
                scanInterval.toMillis(), scanInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleWithFixedDelay(this::purge,
                purgeInterval.toMillis(), purgeInterval.toMillis(), TimeUnit.MILLISECONDS);
        LOG.info("Retry scanner started: interval={} purgeInterval={}", scanInterval, purgeInterval);
    }

    /** One scan pass. Exceptions are logged so the schedule keeps running. */
    void scan() {
        try {
            final int recovered = engine.recoverStaleJobs(clock.instant());
            final int queued    = engine.enqueueDueJobs(clock.instant());
            if (recovered > 0 || queued > 0) {
                LOG.debug("Retry scan: recovered={} queued={}", recovered, queued);
            }
        } catch (RuntimeException e) {
            LOG.warn("Retry scan failed: {}", e.getMessage());
        }
    }

    void purge() {
        try {
            idempotency.purgeExpired();
        } catch (RuntimeException e) {
            LOG.warn("Idempotency purge failed: {}", e.getMessage());
        }
    }

    @Override
    public void close() {
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }
        LOG.info("Retry scanner stopped");
    }
}
