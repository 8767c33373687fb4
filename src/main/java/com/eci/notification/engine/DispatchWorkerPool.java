package com.eci.notification.engine;

import com.eci.notification.config.DispatcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of dispatch workers over a bounded queue.
 *
 * <p>When the queue is full the submitting thread runs the job itself,
 * which slows the Kafka consumer instead of dropping work. A job id is held
 * in {@code inFlight} from enqueue until its processing returns, so the
 * same job never runs on two workers of this process.
 */
public class DispatchWorkerPool implements JobQueue {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchWorkerPool.class);

    private final ThreadPoolExecutor executor;
    private final Set<String>        inFlight = ConcurrentHashMap.newKeySet();
    private volatile JobProcessor    processor;
    private volatile boolean         running;

    public DispatchWorkerPool(final DispatcherConfig config) {
        this(config.getWorkers(), config.getQueueCapacity());
    }

    public DispatchWorkerPool(final int workers, final int queueCapacity) {
        final AtomicInteger seq = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
                workers, workers,
                0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    final Thread t = new Thread(r, "dispatch-worker-" + seq.incrementAndGet());
                    t.setDaemon(false);
                    return t;
                },
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    public void start(final JobProcessor processor) {
        this.processor = processor;
        this.running   = true;
        LOG.info("Dispatch worker pool started: workers={}", executor.getCorePoolSize());
    }

    @Override
    public void enqueue(final String jobId) {
        if (!running) {
            LOG.debug("Worker pool not running, job {} left for the retry scanner", jobId);
            return;
        }
        if (!inFlight.add(jobId)) {
            return;
        }
        try {
            executor.execute(() -> runJob(jobId));
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            LOG.warn("Job {} rejected by worker pool: {}", jobId, e.getMessage());
        }
    }

    private void runJob(final String jobId) {
        try {
            final ProcessOutcome outcome = processor.process(jobId);
            LOG.debug("Job {} processed: {}", jobId, outcome);
        } catch (RuntimeException e) {
            // job stays in its current state; stale recovery picks it up
            LOG.error("Processing job {} failed: {}", jobId, e.getMessage(), e);
        } finally {
            inFlight.remove(jobId);
        }
    }

    public boolean isRunning() {
        return running && !executor.isShutdown();
    }

    /** Jobs waiting or running. */
    public int pendingCount() {
        return inFlight.size();
    }

    /**
     * Stop accepting jobs and wait up to {@code timeout} for queued and
     * running jobs to finish.
     *
     * @return {@code true} if every job finished in time
     */
    public boolean drain(final Duration timeout) {
        running = false;
        executor.shutdown();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                LOG.info("Dispatch worker pool drained");
                return true;
            }
            LOG.warn("Worker pool did not drain in {}, interrupting {} jobs", timeout, inFlight.size());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor.shutdownNow();
        return false;
    }
}
