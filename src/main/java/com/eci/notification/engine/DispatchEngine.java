package com.eci.notification.engine;

import com.eci.notification.channel.Recipients;
import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.error.MissingVariableException;
import com.eci.notification.error.TemplateNotFoundException;
import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.DeliveryAttempt;
import com.eci.notification.model.ErrorKind;
import com.eci.notification.model.Event;
import com.eci.notification.model.IdempotencyRecord;
import com.eci.notification.model.JobState;
import com.eci.notification.model.NotificationJob;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;
import com.eci.notification.retry.BackoffPolicy;
import com.eci.notification.store.IdempotencyStore;
import com.eci.notification.store.NotificationStateStore;
import com.eci.notification.store.Reservation;
import com.eci.notification.template.RenderedContent;
import com.eci.notification.template.Template;
import com.eci.notification.template.TemplateResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns events into notification jobs and drives each job through its
 * lifecycle.
 *
 * <h2>Processing a job</h2>
 * <ol>
 *   <li>Skip it when terminal, already being worked on, or not yet due.</li>
 *   <li>Reserve its dedup key in the {@link IdempotencyStore}. A key already
 *       delivered by another job fails this one as {@code DUPLICATE} without
 *       a provider call.</li>
 *   <li>Render the template once; rendering errors fail the job
 *       permanently.</li>
 *   <li>Make one provider call, record the attempt and classify the result:
 *       success delivers, a retryable failure schedules a retry with
 *       back-off until {@code engine.max-attempts} is reached, anything else
 *       fails the job.</li>
 * </ol>
 * The dedup key is released on every outcome except delivery.
 */
public class DispatchEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DispatchEngine.class);

    private final NotificationStateStore stateStore;
    private final IdempotencyStore       idempotency;
    private final TemplateResolver       templates;
    private final ProviderInvoker        invoker;
    private final BackoffPolicy          backoff;
    private final EventRouter            router;
    private final JobQueue               queue;
    private final Clock                  clock;
    private final int                    maxAttempts;
    private final Duration               staleAfter;
    private final int                    batchSize;
    private final String                 defaultLocale;

    private final AtomicLong received   = new AtomicLong();
    private final AtomicLong accepted   = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong rejected   = new AtomicLong();
    private final AtomicLong delivered  = new AtomicLong();
    private final AtomicLong retried    = new AtomicLong();
    private final AtomicLong failed     = new AtomicLong();

    public DispatchEngine(
            final DispatcherConfig config,
            final NotificationStateStore stateStore,
            final IdempotencyStore idempotency,
            final TemplateResolver templates,
            final ProviderInvoker invoker,
            final JobQueue queue,
            final Clock clock) {
        this(stateStore, idempotency, templates, invoker,
                new BackoffPolicy(config), new EventRouter(config), queue, clock,
                config.getMaxAttempts(), config.getStaleAfter(),
                config.getRetryScanBatchSize(), config.getDefaultLocale());
    }

    DispatchEngine(
            final NotificationStateStore stateStore,
            final IdempotencyStore idempotency,
            final TemplateResolver templates,
            final ProviderInvoker invoker,
            final BackoffPolicy backoff,
            final EventRouter router,
            final JobQueue queue,
            final Clock clock,
            final int maxAttempts,
            final Duration staleAfter,
            final int batchSize,
            final String defaultLocale) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("engine.max-attempts must be at least 1");
        }
        this.stateStore    = stateStore;
        this.idempotency   = idempotency;
        this.templates     = templates;
        this.invoker       = invoker;
        this.backoff       = backoff;
        this.router        = router;
        this.queue         = queue;
        this.clock         = clock;
        this.maxAttempts   = maxAttempts;
        this.staleAfter    = staleAfter;
        this.batchSize     = batchSize;
        this.defaultLocale = defaultLocale;
    }

    // ── Submission ────────────────────────────────────────────────────────────

    /**
     * Validate {@code event}, route it to its recipients and submit one job
     * per (channel, recipient).
     *
     * @return one submission per route; empty when the payload names no recipient
     * @throws ValidationException if the event is malformed or of an unknown type
     */
    public List<Submission> submit(final Event event) {
        final List<EventRouter.Route> routes;
        try {
            routes = router.route(event);
        } catch (ValidationException e) {
            reject(event, e);
            throw e;
        }
        final List<Submission> submissions = new ArrayList<>(routes.size());
        for (final EventRouter.Route route : routes) {
            submissions.add(submitRoute(event, route.channel(), route.recipient()));
        }
        return submissions;
    }

    /**
     * Submit {@code event} for exactly one channel and recipient.
     *
     * @throws ValidationException if the event is malformed, of an unknown
     *         type, or the channel or recipient is missing
     */
    public Submission submit(final Event event, final Channel channel, final String recipient) {
        try {
            router.validate(event);
            if (channel == null) {
                throw new ValidationException("channel is required");
            }
            if (recipient == null || recipient.isBlank()) {
                throw new ValidationException("recipient is required");
            }
        } catch (ValidationException e) {
            reject(event, e);
            throw e;
        }
        return submitRoute(event, channel, recipient);
    }

    /**
     * Create a fresh job for the same event, channel and recipient as the
     * failed job {@code jobId}. The failed job itself is never reopened.
     *
     * @return empty if no job has that id
     * @throws ValidationException if the job has not failed
     */
    public Optional<Submission> resubmit(final String jobId) {
        final Optional<NotificationJob> found = stateStore.findById(jobId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        final NotificationJob old = found.get();
        if (old.getState() != JobState.FAILED) {
            throw new ValidationException(
                    "Job " + jobId + " is " + old.getState() + "; only failed jobs can be retried");
        }
        received.incrementAndGet();

        final Optional<Submission> delivered = deliveredSubmission(old.getDedupKey(), old.getChannel());
        if (delivered.isPresent()) {
            return delivered;
        }

        final NotificationJob candidate = NotificationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .sourceEventId(old.getSourceEventId())
                .eventType(old.getEventType())
                .dedupKey(old.getDedupKey())
                .channel(old.getChannel())
                .recipient(old.getRecipient())
                .locale(old.getLocale())
                .payload(old.getPayload())
                .createdAt(clock.instant())
                .build();
        LOG.info("Resubmitting failed job: jobId={} newJobId={}", jobId, candidate.getJobId());
        return Optional.of(createAndEnqueue(candidate));
    }

    private Submission submitRoute(final Event event, final Channel channel, final String recipient) {
        received.incrementAndGet();
        final String dedupKey = DedupKeys.of(event.getEventId(), channel, recipient);

        final Optional<Submission> delivered = deliveredSubmission(dedupKey, channel);
        if (delivered.isPresent()) {
            LOG.info("Already delivered: eventId={} channel={} jobId={}",
                    event.getEventId(), channel, delivered.get().jobId());
            return delivered.get();
        }

        final NotificationJob candidate = NotificationJob.builder()
                .jobId(UUID.randomUUID().toString())
                .sourceEventId(event.getEventId())
                .eventType(event.getEventType())
                .dedupKey(dedupKey)
                .channel(channel)
                .recipient(recipient.trim())
                .locale(event.getLocale() != null ? event.getLocale() : defaultLocale)
                .payload(event.getPayload())
                .createdAt(clock.instant())
                .build();
        return createAndEnqueue(candidate);
    }

    private Optional<Submission> deliveredSubmission(final String dedupKey, final Channel channel) {
        final Optional<IdempotencyRecord> record = idempotency.find(dedupKey);
        if (record.isPresent() && record.get().isDelivered()) {
            duplicates.incrementAndGet();
            return Optional.of(new Submission(
                    Submission.Status.ALREADY_DELIVERED, record.get().getJobId(), JobState.DELIVERED, channel));
        }
        return Optional.empty();
    }

    private Submission createAndEnqueue(final NotificationJob candidate) {
        final NotificationJob stored = stateStore.createIfAbsent(candidate);
        if (!stored.getJobId().equals(candidate.getJobId())) {
            duplicates.incrementAndGet();
            LOG.info("Job already in progress: jobId={} state={}", stored.getJobId(), stored.getState());
            return new Submission(Submission.Status.IN_PROGRESS, stored.getJobId(), stored.getState(),
                    stored.getChannel());
        }
        // The previous job for this key may have delivered after the first check.
        final Optional<IdempotencyRecord> record = idempotency.find(stored.getDedupKey());
        if (record.isPresent() && record.get().isDelivered()) {
            final String holderJobId = record.get().getJobId();
            stateStore.update(stored.transitionTo(JobState.FAILED, clock.instant())
                    .failed(ErrorKind.DUPLICATE, "Already delivered by job " + holderJobId)
                    .build());
            duplicates.incrementAndGet();
            LOG.info("Job {} is a duplicate of delivered job {}", stored.getJobId(), holderJobId);
            return new Submission(Submission.Status.ALREADY_DELIVERED, holderJobId, JobState.DELIVERED,
                    stored.getChannel());
        }
        accepted.incrementAndGet();
        LOG.info("Job accepted: jobId={} eventId={} type={} channel={} to={}",
                stored.getJobId(), stored.getSourceEventId(), stored.getEventType(),
                stored.getChannel(), Recipients.mask(stored.getChannel(), stored.getRecipient()));
        queue.enqueue(stored.getJobId());
        return new Submission(Submission.Status.ACCEPTED, stored.getJobId(), stored.getState(), stored.getChannel());
    }

    private void reject(final Event event, final ValidationException e) {
        rejected.incrementAndGet();
        LOG.warn("Rejected event: eventId={} type={} reason={}",
                event.getEventId(), event.getEventType(), e.getMessage());
    }

    // ── Processing ────────────────────────────────────────────────────────────

    /**
     * Run one processing step for {@code jobId}. Safe to call for any id at
     * any time; jobs that should not run now are skipped.
     *
     * @throws com.eci.notification.error.StoreUnavailableException if a store
     *         fails; the job is left for stale recovery
     */
    public ProcessOutcome processJob(final String jobId) {
        final Optional<NotificationJob> found = stateStore.findById(jobId);
        if (found.isEmpty()) {
            LOG.warn("Job {} not found", jobId);
            return ProcessOutcome.NOT_FOUND;
        }
        final NotificationJob job = found.get();
        final Instant now = clock.instant();

        if (job.isTerminal()) {
            return ProcessOutcome.SKIPPED_TERMINAL;
        }
        if (job.getState() == JobState.RENDERING || job.getState() == JobState.SENDING) {
            return ProcessOutcome.SKIPPED_IN_FLIGHT;
        }
        if (job.getState() == JobState.RETRYING
                && job.getNextRetryAt() != null && job.getNextRetryAt().isAfter(now)) {
            return ProcessOutcome.SKIPPED_NOT_DUE;
        }

        final Reservation reservation = idempotency.checkAndReserve(job.getDedupKey(), jobId);
        if (reservation.status() == Reservation.Status.IN_FLIGHT) {
            LOG.info("Dedup key of job {} is held by job {}, skipping", jobId, reservation.jobId());
            return ProcessOutcome.SKIPPED_IN_FLIGHT;
        }
        if (reservation.status() == Reservation.Status.ALREADY_DELIVERED) {
            return settleDelivered(job, reservation.jobId(), now);
        }

        try {
            return dispatch(job);
        } catch (RuntimeException e) {
            releaseAfterError(job, e);
            throw e;
        }
    }

    private ProcessOutcome settleDelivered(final NotificationJob job, final String holderJobId, final Instant now) {
        if (holderJobId.equals(job.getJobId()) && job.getState().canTransitionTo(JobState.DELIVERED)) {
            // delivered earlier but the state update was lost
            stateStore.update(job.transitionTo(JobState.DELIVERED, now)
                    .deliveredAt(now)
                    .nextRetryAt(null)
                    .build());
            LOG.info("Job {} was already delivered, state reconciled", job.getJobId());
            return ProcessOutcome.DELIVERED;
        }
        stateStore.update(job.transitionTo(JobState.FAILED, now)
                .failed(ErrorKind.DUPLICATE, "Already delivered by job " + holderJobId)
                .build());
        duplicates.incrementAndGet();
        LOG.info("Job {} is a duplicate of delivered job {}", job.getJobId(), holderJobId);
        return ProcessOutcome.FAILED;
    }

    private ProcessOutcome dispatch(NotificationJob job) {
        if (!job.isRendered()) {
            job = stateStore.update(job.transitionTo(JobState.RENDERING, clock.instant()).build());
            final RenderedContent content;
            try {
                final Template template = templates.resolve(job.getEventType(), job.getLocale());
                content = templates.render(template, job.getPayload(), job.getChannel());
            } catch (TemplateNotFoundException | MissingVariableException e) {
                return fail(job, e.getKind(), e.getMessage());
            }
            job = stateStore.update(job.transitionTo(JobState.SENDING, clock.instant())
                    .templateId(content.getTemplateId())
                    .renderedSubject(content.getSubject())
                    .renderedBody(content.getBody())
                    .build());
        } else {
            job = stateStore.update(job.transitionTo(JobState.SENDING, clock.instant()).build());
        }

        final Instant sentAt = clock.instant();
        final long    t0     = System.nanoTime();
        final ProviderResult result = invoker.invoke(RenderedNotification.of(job));
        final long    durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
        final Instant now        = clock.instant();
        final int     attemptNo  = job.getAttemptCount() + 1;
        final DeliveryAttempt attempt = new DeliveryAttempt(job.getJobId(), attemptNo, result, sentAt, durationMs);

        if (result.isSuccess()) {
            idempotency.markDelivered(job.getDedupKey(), job.getJobId());
            stateStore.recordAttempt(job.transitionTo(JobState.DELIVERED, now)
                    .attemptCount(attemptNo)
                    .lastAttemptAt(sentAt)
                    .providerMessageId(result.getProviderMessageId())
                    .deliveredAt(now)
                    .errorKind(null)
                    .lastError(null)
                    .nextRetryAt(null)
                    .build(), attempt);
            delivered.incrementAndGet();
            LOG.info("Delivered: jobId={} channel={} provider={} msgId={} attempt={}",
                    job.getJobId(), job.getChannel(), result.getProvider(),
                    result.getProviderMessageId(), attemptNo);
            return ProcessOutcome.DELIVERED;
        }

        if (result.getStatus() == ProviderResult.Status.RETRYABLE_FAILURE && attemptNo < maxAttempts) {
            final Instant nextRetryAt = now.plus(backoff.delay(attemptNo));
            stateStore.recordAttempt(job.transitionTo(JobState.RETRYING, now)
                    .attemptCount(attemptNo)
                    .lastAttemptAt(sentAt)
                    .errorKind(ErrorKind.RETRYABLE_FAILURE)
                    .lastError(result.getErrorMessage())
                    .nextRetryAt(nextRetryAt)
                    .build(), attempt);
            idempotency.release(job.getDedupKey(), job.getJobId());
            retried.incrementAndGet();
            LOG.warn("Delivery failed (attempt {}/{}): jobId={} provider={} error={}; retry at {}",
                    attemptNo, maxAttempts, job.getJobId(), result.getProvider(),
                    result.getErrorMessage(), nextRetryAt);
            return ProcessOutcome.RETRY_SCHEDULED;
        }

        final ErrorKind kind = result.getStatus() == ProviderResult.Status.RETRYABLE_FAILURE
                ? ErrorKind.EXHAUSTED_RETRIES
                : ErrorKind.PERMANENT_FAILURE;
        stateStore.recordAttempt(job.transitionTo(JobState.FAILED, now)
                .attemptCount(attemptNo)
                .lastAttemptAt(sentAt)
                .failed(kind, result.getErrorMessage())
                .build(), attempt);
        idempotency.release(job.getDedupKey(), job.getJobId());
        failed.incrementAndGet();
        auditFailure(job, kind, result.getErrorMessage(), attemptNo);
        return ProcessOutcome.FAILED;
    }

    private ProcessOutcome fail(final NotificationJob job, final ErrorKind kind, final String error) {
        stateStore.update(job.transitionTo(JobState.FAILED, clock.instant())
                .failed(kind, error)
                .build());
        idempotency.release(job.getDedupKey(), job.getJobId());
        failed.incrementAndGet();
        auditFailure(job, kind, error, job.getAttemptCount());
        return ProcessOutcome.FAILED;
    }

    private void auditFailure(final NotificationJob job, final ErrorKind kind, final String error, final int attempts) {
        LOG.error("Notification failed: jobId={} eventId={} type={} channel={} to={} kind={} attempts={} error={}",
                job.getJobId(), job.getSourceEventId(), job.getEventType(), job.getChannel(),
                Recipients.mask(job.getChannel(), job.getRecipient()), kind, attempts, error);
    }

    private void releaseAfterError(final NotificationJob job, final RuntimeException cause) {
        try {
            idempotency.release(job.getDedupKey(), job.getJobId());
        } catch (RuntimeException e) {
            cause.addSuppressed(e);
        }
    }

    // ── Scans ─────────────────────────────────────────────────────────────────

    /**
     * Queue every retrying job whose retry time has come.
     *
     * @return number of jobs queued
     */
    public int enqueueDueJobs(final Instant now) {
        final List<NotificationJob> due = stateStore.findDueForRetry(now, batchSize);
        due.forEach(job -> queue.enqueue(job.getJobId()));
        return due.size();
    }

    /**
     * Recover jobs that made no progress for {@code retry.stale-after}:
     * pending jobs are queued again, rendering and sending jobs move to
     * {@code RETRYING} and become due immediately.
     *
     * @return number of jobs recovered
     */
    public int recoverStaleJobs(final Instant now) {
        int recovered = 0;
        for (final NotificationJob job : stateStore.findStale(now.minus(staleAfter), batchSize)) {
            if (job.getState() == JobState.PENDING) {
                queue.enqueue(job.getJobId());
                recovered++;
                continue;
            }
            try {
                stateStore.update(job.transitionTo(JobState.RETRYING, now)
                        .nextRetryAt(now)
                        .lastError("Recovered from " + job.getState() + " with no progress since "
                                + job.getUpdatedAt())
                        .build());
                recovered++;
                LOG.warn("Recovered stale job: jobId={} state={} updatedAt={}",
                        job.getJobId(), job.getState(), job.getUpdatedAt());
            } catch (IllegalStateException e) {
                LOG.debug("Job {} changed during recovery: {}", job.getJobId(), e.getMessage());
            }
        }
        return recovered;
    }

    public EngineStats stats() {
        return new EngineStats(
                received.get(), accepted.get(), duplicates.get(), rejected.get(),
                delivered.get(), retried.get(), failed.get());
    }
}
