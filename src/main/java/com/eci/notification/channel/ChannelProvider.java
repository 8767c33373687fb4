package com.eci.notification.channel;

import com.eci.notification.model.Channel;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;

/**
 * Pluggable delivery provider for one {@link Channel}.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Implementations must be thread-safe; one instance is shared by all
 *       dispatch workers.</li>
 *   <li>{@link #send} makes at most one external call and <em>never</em>
 *       throws: every failure is classified into a {@link ProviderResult}.
 *       Retry decisions are made by the engine above this layer.</li>
 *   <li>Implementations must close their HTTP clients in {@link #close()}.</li>
 * </ul>
 */
public interface ChannelProvider extends AutoCloseable {

    /** Provider name for logging and the audit trail (e.g. "sendgrid"). */
    String providerName();

    Channel channel();

    /**
     * Deliver one rendered message.
     *
     * @return the classified outcome; never null
     */
    ProviderResult send(RenderedNotification notification);

    /**
     * Returns {@code true} if the provider has the credentials it needs.
     * Checked once at startup.
     */
    boolean isConfigured();

    @Override
    void close();
}
