package com.eci.notification.channel;

import com.eci.notification.model.Channel;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Provider that only logs the message. Used for local runs where no
 * provider credentials are configured.
 */
public class LoggingChannelProvider implements ChannelProvider {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingChannelProvider.class);

    private final Channel channel;

    public LoggingChannelProvider(final Channel channel) {
        this.channel = channel;
    }

    @Override public String  providerName() { return "log"; }
    @Override public Channel channel()      { return channel; }
    @Override public boolean isConfigured() { return true; }

    @Override
    public ProviderResult send(final RenderedNotification notification) {
        if (!Recipients.isValid(channel, notification.getRecipient())) {
            return ProviderResponses.invalidRecipient(providerName(), channel);
        }
        final String msgId = "log-" + UUID.randomUUID();
        LOG.info("[{}] to={} jobId={} subject={} body={}",
                channel, Recipients.mask(channel, notification.getRecipient()),
                notification.getJobId(), notification.getSubject(), notification.getBody());
        return ProviderResult.builder(providerName(), channel).success(msgId, 0).build();
    }

    @Override
    public void close() { }
}
