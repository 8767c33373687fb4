package com.eci.notification.channel;

import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.model.Channel;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Builds the active {@link ChannelProvider} of each channel from the
 * application config.
 *
 * <p>Providers are listed per channel in priority order; the first entry
 * that is enabled and has its credentials becomes the channel's provider.
 * There is no failover between providers at send time.
 */
public final class ChannelProviderFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ChannelProviderFactory.class);

    private ChannelProviderFactory() {}

    /**
     * One provider per channel. Channels without a usable provider are
     * absent from the map; their jobs fail permanently.
     */
    public static Map<Channel, ChannelProvider> build(final DispatcherConfig config) {
        final Map<Channel, ChannelProvider> providers = new EnumMap<>(Channel.class);
        for (final Channel channel : Channel.values()) {
            for (final Config entry : config.getActiveProviders(channel)) {
                final String name = entry.getString("name");
                final ChannelProvider provider;
                try {
                    provider = buildProvider(channel, name, entry, config.getProviderTimeout());
                } catch (IllegalArgumentException e) {
                    LOG.error("Failed to build {} provider '{}': {}", channel, name, e.getMessage());
                    continue;
                }
                if (provider.isConfigured()) {
                    providers.put(channel, provider);
                    LOG.info("{} provider ready: provider={}", channel, name);
                    break;
                }
                LOG.warn("{} provider '{}' is enabled in config but missing credentials, skipping", channel, name);
                provider.close();
            }
            if (!providers.containsKey(channel)) {
                LOG.warn("No {} provider is configured. {} notifications will fail.", channel, channel);
            }
        }
        return providers;
    }

    static ChannelProvider buildProvider(
            final Channel channel,
            final String name,
            final Config cfg,
            final Duration timeout) {
        if ("log".equalsIgnoreCase(name)) {
            return new LoggingChannelProvider(channel);
        }
        return switch (channel) {
            case EMAIL -> switch (name.toLowerCase()) {
                case "sendgrid" -> new SendGridEmailProvider(
                        cfgStr(cfg, "api-key"),
                        cfgStr(cfg, "from"),
                        cfgStrOpt(cfg, "from-name"),
                        cfgStrOpt(cfg, "reply-to"),
                        cfg.hasPath("endpoint") ? cfg.getString("endpoint") : SendGridEmailProvider.DEFAULT_ENDPOINT,
                        timeout);
                default -> throw new IllegalArgumentException("Unknown email provider: " + name);
            };
            case SMS -> switch (name.toLowerCase()) {
                case "twilio" -> new TwilioSmsProvider(
                        cfgStr(cfg, "account-sid"),
                        cfgStr(cfg, "auth-token"),
                        cfgStr(cfg, "from-number"),
                        cfg.hasPath("base-url") ? cfg.getString("base-url") : TwilioSmsProvider.DEFAULT_BASE_URL,
                        timeout);
                default -> throw new IllegalArgumentException("Unknown SMS provider: " + name);
            };
        };
    }

    private static String cfgStr(final Config cfg, final String key) {
        return cfg.hasPath(key) ? cfg.getString(key) : "";
    }

    private static String cfgStrOpt(final Config cfg, final String key) {
        return cfg.hasPath(key) ? cfg.getString(key) : null;
    }
}
