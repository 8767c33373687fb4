package com.eci.notification.config;

import com.eci.notification.model.Channel;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigUtil;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed configuration for the dispatch service, loaded from
 * {@code application.conf} via Typesafe Config.
 *
 * <p>All secrets (API keys, auth tokens) are read from environment variables
 * via Typesafe Config substitution (e.g. {@code ${?SENDGRID_API_KEY}}).
 * This class never holds or logs secret values.
 */
public final class DispatcherConfig {

    private final Config raw;

    private DispatcherConfig(final Config config) {
        this.raw = config;
    }

    public static DispatcherConfig load() {
        return new DispatcherConfig(ConfigFactory.load().resolve());
    }

    /** Wraps an already-built config; used by tests to override single keys. */
    public static DispatcherConfig from(final Config config) {
        return new DispatcherConfig(config.resolve());
    }

    public Config raw() {
        return raw;
    }

    // ── Service ───────────────────────────────────────────────────────────────

    public String getServiceName() {
        return raw.getString("service.name");
    }

    public String getServiceVersion() {
        return raw.getString("service.version");
    }

    // ── Kafka ─────────────────────────────────────────────────────────────────

    public String getBootstrapServers() {
        return raw.getString("kafka.bootstrap-servers");
    }

    public String getConsumerGroupId() {
        return raw.getString("kafka.consumer.group-id");
    }

    public String getAutoOffsetReset() {
        return raw.getString("kafka.consumer.auto-offset-reset");
    }

    public int getMaxPollRecords() {
        return raw.getInt("kafka.consumer.max-poll-records");
    }

    public int getSessionTimeoutMs() {
        return raw.getInt("kafka.consumer.session-timeout-ms");
    }

    public int getHeartbeatIntervalMs() {
        return raw.getInt("kafka.consumer.heartbeat-interval-ms");
    }

    public List<String> getTopics() {
        return raw.getStringList("kafka.topics");
    }

    public Duration getPauseOnFailure() {
        return raw.getDuration("kafka.pause-on-failure");
    }

    public Duration getKafkaHealthTimeout() {
        return raw.getDuration("kafka.health-timeout");
    }

    // ── Events ────────────────────────────────────────────────────────────────

    public Set<String> getKnownEventTypes() {
        return Set.copyOf(raw.getStringList("events.known-types"));
    }

    public String getDefaultLocale() {
        return raw.getString("events.default-locale");
    }

    public List<Channel> getDefaultChannels() {
        return toChannels(raw.getStringList("events.default-channels"));
    }

    /** Channels configured for {@code eventType}, or the default channels. */
    public List<Channel> getChannelsFor(final String eventType) {
        final String path = "events.routing." + ConfigUtil.joinPath(eventType);
        return raw.hasPath(path) ? toChannels(raw.getStringList(path)) : getDefaultChannels();
    }

    public Map<Channel, String> getRecipientKeys() {
        final Map<Channel, String> keys = new EnumMap<>(Channel.class);
        final Config section = raw.getConfig("events.recipient-keys");
        for (final Channel channel : Channel.values()) {
            if (section.hasPath(channel.name())) {
                keys.put(channel, section.getString(channel.name()));
            }
        }
        return keys;
    }

    // ── Engine ────────────────────────────────────────────────────────────────

    public int getWorkers() {
        return raw.getInt("engine.workers");
    }

    public int getQueueCapacity() {
        return raw.getInt("engine.queue-capacity");
    }

    public int getMaxAttempts() {
        return raw.getInt("engine.max-attempts");
    }

    public Duration getProviderTimeout() {
        return raw.getDuration("engine.provider-timeout");
    }

    public Duration getDrainTimeout() {
        return raw.getDuration("engine.drain-timeout");
    }

    // ── Retry ─────────────────────────────────────────────────────────────────

    public Duration getRetryBaseDelay() {
        return raw.getDuration("retry.base-delay");
    }

    public Duration getRetryMaxDelay() {
        return raw.getDuration("retry.max-delay");
    }

    public double getRetryJitterRatio() {
        return raw.getDouble("retry.jitter-ratio");
    }

    public Duration getRetryScanInterval() {
        return raw.getDuration("retry.scan-interval");
    }

    public int getRetryScanBatchSize() {
        return raw.getInt("retry.scan-batch-size");
    }

    public Duration getStaleAfter() {
        return raw.getDuration("retry.stale-after");
    }

    // ── Idempotency ───────────────────────────────────────────────────────────

    public Duration getDeliveredRetention() {
        return raw.getDuration("idempotency.delivered-retention");
    }

    public Duration getInFlightLease() {
        return raw.getDuration("idempotency.in-flight-lease");
    }

    public Duration getIdempotencyPurgeInterval() {
        return raw.getDuration("idempotency.purge-interval");
    }

    // ── Channel providers ─────────────────────────────────────────────────────

    /** All providers of {@code channel} where enabled=true, in priority order. */
    public List<? extends Config> getActiveProviders(final Channel channel) {
        return raw.getConfigList("channels." + channel.name().toLowerCase() + ".providers").stream()
                .filter(c -> c.hasPath("enabled") && c.getBoolean("enabled"))
                .collect(Collectors.toList());
    }

    // ── Templates ─────────────────────────────────────────────────────────────

    public Config getTemplates() {
        return raw.hasPath("templates") ? raw.getConfig("templates") : ConfigFactory.empty();
    }

    // ── Management ────────────────────────────────────────────────────────────

    public int getManagementPort() {
        return raw.getInt("management.port");
    }

    public int getManagementThreads() {
        return raw.getInt("management.threads");
    }

    private static List<Channel> toChannels(final List<String> names) {
        return names.stream().map(Channel::parse).distinct().collect(Collectors.toList());
    }
}
