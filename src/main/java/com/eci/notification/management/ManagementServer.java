package com.eci.notification.management;

import com.eci.notification.consumer.InboundEventParser;
import com.eci.notification.engine.DispatchEngine;
import com.eci.notification.engine.EngineStats;
import com.eci.notification.engine.Submission;
import com.eci.notification.error.StoreUnavailableException;
import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.DeliveryAttempt;
import com.eci.notification.model.Event;
import com.eci.notification.model.JobState;
import com.eci.notification.model.NotificationJob;
import com.eci.notification.store.JobQuery;
import com.eci.notification.store.JobStats;
import com.eci.notification.store.NotificationStateStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Management HTTP server.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code GET /health}: 200 when ready and every component check
 *       passes, 503 otherwise; the body lists each component.</li>
 *   <li>{@code GET /health/live}: liveness probe (always 200 while the JVM runs).</li>
 *   <li>{@code GET /health/ready}: readiness probe.</li>
 *   <li>{@code POST /notifications}: manual send.</li>
 *   <li>{@code GET /notifications}: list jobs, filtered by
 *       {@code state}, {@code channel}, {@code event_type}, {@code event_id}, paged by {@code limit} and {@code offset}.</li>
 *   <li>{@code GET /notifications/stats}: job and engine counters.</li>
 *   <li>{@code GET /notifications/{job_id}}: one job with its attempts.</li>
 *   <li>{@code POST /notifications/{job_id}/retry}: resubmit a failed job.</li>
 * </ul>
 */
public class ManagementServer {

    private static final Logger LOG = LoggerFactory.getLogger(ManagementServer.class);
    private static final String NOTIFICATIONS = "/notifications";

    private final HttpServer             server;
    private final ExecutorService        executor;
    private final DispatchEngine         engine;
    private final NotificationStateStore stateStore;
    private final InboundEventParser     parser;
    private final List<HealthCheck>      checks;
    private final ObjectMapper           mapper;
    private final String                 serviceName;
    private final AtomicBoolean          ready = new AtomicBoolean(false);

    public ManagementServer(
            final int port,
            final int threads,
            final String serviceName,
            final DispatchEngine engine,
            final NotificationStateStore stateStore,
            final InboundEventParser parser,
            final List<HealthCheck> checks,
            final ObjectMapper mapper) throws IOException {
        this.engine      = engine;
        this.stateStore  = stateStore;
        this.parser      = parser;
        this.checks      = List.copyOf(checks);
        this.mapper      = mapper;
        this.serviceName = serviceName;

        final AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            final Thread t = new Thread(r, "management-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        server.setExecutor(executor);

        server.createContext("/health",       this::handleHealth);
        server.createContext("/health/live",  this::handleLive);
        server.createContext("/health/ready", this::handleReady);
        server.createContext(NOTIFICATIONS,   this::handleNotifications);
    }

    public void start() {
        server.start();
        LOG.info("Management server started on port {}", getPort());
    }

    public int getPort() {
        return server.getAddress().getPort();
    }

    /** Mark the service as ready to receive traffic. */
    public void markReady() {
        ready.set(true);
        LOG.info("Service marked as ready");
    }

    /** Mark the service as not ready (e.g. during shutdown). */
    public void markNotReady() {
        ready.set(false);
    }

    public void stop() {
        markNotReady();
        server.stop(1);
        executor.shutdownNow();
        LOG.info("Management server stopped");
    }

    // ── Health ────────────────────────────────────────────────────────────────

    private void handleHealth(final HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) return;
        final ObjectNode components = mapper.createObjectNode();
        boolean healthy = ready.get();
        for (final HealthCheck check : checks) {
            final boolean up = check.isHealthy();
            components.put(check.name(), up ? "UP" : "DOWN");
            healthy &= up;
        }
        final ObjectNode body = mapper.createObjectNode();
        body.put("status",  healthy ? "UP" : "DOWN");
        body.put("service", serviceName);
        body.put("ready",   ready.get());
        body.set("components", components);
        respond(exchange, healthy ? 200 : 503, body);
    }

    private void handleLive(final HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) return;
        respond(exchange, 200, mapper.createObjectNode().put("status", "ALIVE"));
    }

    private void handleReady(final HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) return;
        final boolean isReady = ready.get() && checks.stream().allMatch(HealthCheck::isHealthy);
        respond(exchange, isReady ? 200 : 503,
                mapper.createObjectNode().put("status", isReady ? "READY" : "NOT_READY"));
    }

    // ── Notifications ─────────────────────────────────────────────────────────

    private void handleNotifications(final HttpExchange exchange) throws IOException {
        final String path = exchange.getRequestURI().getPath();
        final String method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
        if (path.length() > NOTIFICATIONS.length() && path.charAt(NOTIFICATIONS.length()) != '/') {
            respondError(exchange, 404, "NOT_FOUND", "No route for " + path);
            return;
        }
        final String rest = path.length() > NOTIFICATIONS.length()
                ? path.substring(NOTIFICATIONS.length() + 1)
                : "";
        try {
            if (rest.isEmpty()) {
                switch (method) {
                    case "POST" -> handleSend(exchange);
                    case "GET"  -> handleList(exchange);
                    default     -> methodNotAllowed(exchange);
                }
            } else if (rest.equals("stats")) {
                if (requireMethod(exchange, "GET")) handleStats(exchange);
            } else if (rest.endsWith("/retry") && rest.indexOf('/') == rest.length() - "/retry".length()) {
                if (requireMethod(exchange, "POST")) {
                    handleRetry(exchange, rest.substring(0, rest.length() - "/retry".length()));
                }
            } else if (rest.indexOf('/') < 0) {
                if (requireMethod(exchange, "GET")) handleDetail(exchange, rest);
            } else {
                respondError(exchange, 404, "NOT_FOUND", "No route for " + path);
            }
        } catch (ValidationException e) {
            respondError(exchange, 400, e.getKind().name(), e.getMessage());
        } catch (StoreUnavailableException e) {
            LOG.warn("Store unavailable while handling {} {}: {}", method, path, e.getMessage());
            respondError(exchange, 503, e.getKind().name(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.error("Unhandled error for {} {}", method, path, e);
            respondError(exchange, 500, "INTERNAL_ERROR", "Internal error");
        }
    }

    private void handleSend(final HttpExchange exchange) throws IOException {
        final Event event = parser.parse(readBody(exchange), UUID.randomUUID().toString());
        final Submission submission = engine.submit(event, event.getChannel(), event.getRecipient());

        if (submission.status() == Submission.Status.ALREADY_DELIVERED) {
            final ObjectNode body = mapper.createObjectNode();
            body.put("error_kind", "ALREADY_DELIVERED");
            body.put("job_id",     submission.jobId());
            body.put("message",    "Notification was already delivered");
            respond(exchange, 409, body);
            return;
        }
        respond(exchange, 202, submissionNode(submission));
    }

    private void handleList(final HttpExchange exchange) throws IOException {
        final Map<String, String> params = queryParams(exchange);
        final JobQuery query = new JobQuery(
                params.containsKey("state") ? parseState(params.get("state")) : null,
                params.containsKey("channel") ? parseChannel(params.get("channel")) : null,
                params.get("event_type"),
                params.get("event_id"),
                params.containsKey("limit") ? parseLimit(params.get("limit")) : JobQuery.DEFAULT_LIMIT,
                params.containsKey("offset") ? parseOffset(params.get("offset")) : 0);

        final List<NotificationJob> jobs = stateStore.query(query);
        final ObjectNode body = mapper.createObjectNode();
        body.put("count",  jobs.size());
        body.put("offset", query.offset());
        body.put("limit",  query.limit());
        if (jobs.size() == query.limit()) {
            body.put("next_offset", query.offset() + jobs.size());
        }
        final ArrayNode results = body.putArray("results");
        jobs.forEach(job -> results.add(jobNode(job)));
        respond(exchange, 200, body);
    }

    private void handleDetail(final HttpExchange exchange, final String jobId) throws IOException {
        final Optional<NotificationJob> job = stateStore.findById(jobId);
        if (job.isEmpty()) {
            respondError(exchange, 404, "NOT_FOUND", "Job " + jobId + " not found");
            return;
        }
        final ObjectNode body = jobNode(job.get());
        body.put("rendered_subject", job.get().getRenderedSubject());
        body.put("rendered_body",    job.get().getRenderedBody());
        final ObjectNode payload = body.putObject("payload");
        job.get().getPayload().forEach(payload::put);
        final ArrayNode attempts = body.putArray("attempts");
        for (final DeliveryAttempt a : stateStore.findAttempts(jobId)) {
            final ObjectNode node = attempts.addObject();
            node.put("attempt_no",             a.getAttemptNo());
            node.put("provider",               a.getProvider());
            node.put("provider_response_code", a.getProviderResponseCode());
            node.put("succeeded",              a.isSucceeded());
            node.put("error_kind",             a.getErrorKind() != null ? a.getErrorKind().name() : null);
            node.put("error_message",          a.getErrorMessage());
            putInstant(node, "timestamp",      a.getTimestamp());
            node.put("duration_ms",            a.getDurationMs());
        }
        respond(exchange, 200, body);
    }

    private void handleRetry(final HttpExchange exchange, final String jobId) throws IOException {
        final Optional<Submission> submission = engine.resubmit(jobId);
        if (submission.isEmpty()) {
            respondError(exchange, 404, "NOT_FOUND", "Job " + jobId + " not found");
            return;
        }
        final Submission s = submission.get();
        if (s.status() == Submission.Status.ALREADY_DELIVERED) {
            final ObjectNode body = mapper.createObjectNode();
            body.put("error_kind", "ALREADY_DELIVERED");
            body.put("job_id",     s.jobId());
            body.put("message",    "Notification was already delivered");
            respond(exchange, 409, body);
            return;
        }
        final ObjectNode body = submissionNode(s);
        body.put("retried_job_id", jobId);
        respond(exchange, 202, body);
    }

    private void handleStats(final HttpExchange exchange) throws IOException {
        final JobStats   jobs   = stateStore.stats();
        final EngineStats counters = engine.stats();

        final ObjectNode body = mapper.createObjectNode();
        body.put("total",     jobs.total());
        body.put("delivered", jobs.count(JobState.DELIVERED));
        body.put("failed",    jobs.count(JobState.FAILED));
        body.put("pending",   jobs.total() - jobs.count(JobState.DELIVERED) - jobs.count(JobState.FAILED));
        body.put("success_rate", jobs.total() == 0 ? 0.0
                : Math.round(jobs.count(JobState.DELIVERED) * 10000.0 / jobs.total()) / 100.0);

        final ObjectNode byState = body.putObject("by_state");
        jobs.byState().forEach((state, n) -> byState.put(state.name(), n));
        final ObjectNode byChannel = body.putObject("by_channel");
        jobs.byChannel().forEach((channel, n) -> byChannel.put(channel.name(), n));
        final ObjectNode byType = body.putObject("by_event_type");
        jobs.byEventType().forEach(byType::put);

        final ObjectNode engineNode = body.putObject("engine");
        engineNode.put("received",   counters.received());
        engineNode.put("accepted",   counters.accepted());
        engineNode.put("duplicates", counters.duplicates());
        engineNode.put("rejected",   counters.rejected());
        engineNode.put("delivered",  counters.delivered());
        engineNode.put("retried",    counters.retried());
        engineNode.put("failed",     counters.failed());
        respond(exchange, 200, body);
    }

    // ── JSON views ────────────────────────────────────────────────────────────

    private ObjectNode submissionNode(final Submission s) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("job_id",  s.jobId());
        node.put("state",   s.state().name());
        node.put("status",  s.status().name());
        node.put("channel", s.channel().name());
        return node;
    }

    private ObjectNode jobNode(final NotificationJob job) {
        final ObjectNode node = mapper.createObjectNode();
        node.put("job_id",              job.getJobId());
        node.put("source_event_id",     job.getSourceEventId());
        node.put("event_type",          job.getEventType());
        node.put("channel",             job.getChannel().name());
        node.put("recipient",           job.getRecipient());
        node.put("locale",              job.getLocale());
        node.put("state",               job.getState().name());
        node.put("attempt_count",       job.getAttemptCount());
        node.put("template_id",         job.getTemplateId());
        node.put("error_kind",          job.getErrorKind() != null ? job.getErrorKind().name() : null);
        node.put("last_error",          job.getLastError());
        node.put("provider_message_id", job.getProviderMessageId());
        putInstant(node, "created_at",      job.getCreatedAt());
        putInstant(node, "updated_at",      job.getUpdatedAt());
        putInstant(node, "last_attempt_at", job.getLastAttemptAt());
        putInstant(node, "next_retry_at",   job.getNextRetryAt());
        putInstant(node, "delivered_at",    job.getDeliveredAt());
        return node;
    }

    private void putInstant(final ObjectNode node, final String field, final Instant value) {
        if (value == null) {
            node.putNull(field);
        } else {
            node.set(field, mapper.valueToTree(value));
        }
    }

    // ── Request parsing ───────────────────────────────────────────────────────

    private static JobState parseState(final String value) {
        try {
            return JobState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown state: " + value, e);
        }
    }

    private static Channel parseChannel(final String value) {
        try {
            return Channel.parse(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
    }

    private static int parseLimit(final String value) {
        try {
            final int limit = Integer.parseInt(value.trim());
            if (limit < 1) throw new ValidationException("limit must be positive");
            return limit;
        } catch (NumberFormatException e) {
            throw new ValidationException("limit must be a number: " + value, e);
        }
    }

    private static int parseOffset(final String value) {
        try {
            final int offset = Integer.parseInt(value.trim());
            if (offset < 0) throw new ValidationException("offset must not be negative");
            return offset;
        } catch (NumberFormatException e) {
            throw new ValidationException("offset must be a number: " + value, e);
        }
    }

    private static Map<String, String> queryParams(final HttpExchange exchange) {
        final Map<String, String> params = new HashMap<>();
        final String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) return params;
        for (final String pair : raw.split("&")) {
            final int eq = pair.indexOf('=');
            final String key   = URLDecoder.decode(eq < 0 ? pair : pair.substring(0, eq), StandardCharsets.UTF_8);
            final String value = eq < 0 ? "" : URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
            if (!value.isBlank()) params.put(key, value);
        }
        return params;
    }

    private static String readBody(final HttpExchange exchange) throws IOException {
        try (InputStream in = exchange.getRequestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    // ── Responses ─────────────────────────────────────────────────────────────

    private boolean requireMethod(final HttpExchange exchange, final String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) return true;
        methodNotAllowed(exchange);
        return false;
    }

    private void methodNotAllowed(final HttpExchange exchange) throws IOException {
        respondError(exchange, 405, "METHOD_NOT_ALLOWED",
                exchange.getRequestMethod() + " not allowed on " + exchange.getRequestURI().getPath());
    }

    private void respondError(final HttpExchange exchange,
                              final int statusCode,
                              final String errorKind,
                              final String message) throws IOException {
        final ObjectNode body = mapper.createObjectNode();
        body.put("error_kind", errorKind);
        body.put("message",    message);
        respond(exchange, statusCode, body);
    }

    private void respond(final HttpExchange exchange,
                         final int statusCode,
                         final ObjectNode body) throws IOException {
        final byte[] bytes = mapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
