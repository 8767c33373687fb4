package com.eci.notification.engine;

import com.eci.notification.channel.ChannelProvider;
import com.eci.notification.model.Channel;
import com.eci.notification.model.ProviderResult;
import com.eci.notification.model.RenderedNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs provider calls on a dedicated executor so a hung provider cannot
 * hold a dispatch worker past {@code engine.provider-timeout}.
 *
 * <p>A call that exceeds the timeout is cancelled (interrupting its thread)
 * and reported as a retryable failure.
 */
public class ProviderInvoker implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ProviderInvoker.class);

    private final Map<Channel, ChannelProvider> providers;
    private final Duration                      timeout;
    private final ExecutorService               executor;

    public ProviderInvoker(final Map<Channel, ChannelProvider> providers, final Duration timeout) {
        this.providers = providers.isEmpty() ? new EnumMap<>(Channel.class) : new EnumMap<>(providers);
        this.timeout   = timeout;
        final AtomicInteger seq = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            final Thread t = new Thread(r, "provider-call-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean hasProvider(final Channel channel) {
        return providers.containsKey(channel);
    }

    /** Send through the channel's provider. Never throws. */
    public ProviderResult invoke(final RenderedNotification notification) {
        final Channel channel = notification.getChannel();
        final ChannelProvider provider = providers.get(channel);
        if (provider == null) {
            return ProviderResult.builder("none", channel)
                    .permanent("No " + channel + " provider configured", 0)
                    .build();
        }

        final Future<ProviderResult> future;
        try {
            future = executor.submit(() -> provider.send(notification));
        } catch (RejectedExecutionException e) {
            return ProviderResult.builder(provider.providerName(), channel)
                    .retryable("Provider executor is shut down", 0)
                    .build();
        }

        try {
            final ProviderResult result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                return ProviderResult.builder(provider.providerName(), channel)
                        .retryable("Provider returned no result", 0)
                        .build();
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Provider call timed out: provider={} jobId={} timeout={}",
                    provider.providerName(), notification.getJobId(), timeout);
            return ProviderResult.builder(provider.providerName(), channel)
                    .retryable("Timed out after " + timeout.toMillis() + "ms", 0)
                    .build();
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.error("Provider {} threw for jobId={}", provider.providerName(), notification.getJobId(), cause);
            return ProviderResult.builder(provider.providerName(), channel)
                    .retryable("Provider error: " + cause.getMessage(), 0)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return ProviderResult.builder(provider.providerName(), channel)
                    .retryable("Interrupted while waiting for provider", 0)
                    .build();
        }
    }

    /** Stops the call executor and closes every provider. */
    @Override
    public void close() {
        executor.shutdownNow();
        providers.values().forEach(p -> {
            try {
                p.close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to close provider {}: {}", p.providerName(), e.getMessage());
            }
        });
    }
}
