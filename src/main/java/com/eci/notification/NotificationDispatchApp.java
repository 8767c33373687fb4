package com.eci.notification;

import com.eci.notification.channel.ChannelProvider;
import com.eci.notification.channel.ChannelProviderFactory;
import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.consumer.InboundEventParser;
import com.eci.notification.consumer.NotificationEventConsumer;
import com.eci.notification.engine.DispatchEngine;
import com.eci.notification.engine.DispatchWorkerPool;
import com.eci.notification.engine.ProviderInvoker;
import com.eci.notification.engine.RetryScanner;
import com.eci.notification.management.HealthCheck;
import com.eci.notification.management.KafkaQueueHealthCheck;
import com.eci.notification.management.ManagementServer;
import com.eci.notification.model.Channel;
import com.eci.notification.store.IdempotencyStore;
import com.eci.notification.store.InMemoryIdempotencyStore;
import com.eci.notification.store.InMemoryNotificationStateStore;
import com.eci.notification.store.NotificationStateStore;
import com.eci.notification.template.ConfigTemplateResolver;
import com.eci.notification.template.TemplateResolver;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * ECI Notification Dispatch Service, main entry point.
 *
 * <h2>Startup sequence</h2>
 * <ol>
 *   <li>Load configuration and templates</li>
 *   <li>Build channel providers (fail fast if no channel has one)</li>
 *   <li>Create stores, worker pool, engine and retry scanner</li>
 *   <li>Start the management HTTP server</li>
 *   <li>Start the Kafka consumer loop on a dedicated thread</li>
 *   <li>Register the JVM shutdown hook for graceful drain</li>
 * </ol>
 *
 * <h2>Shutdown sequence</h2>
 * Not ready, consumer stopped, scanner stopped, workers drained, then
 * providers and stores closed.
 */
public class NotificationDispatchApp {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationDispatchApp.class);

    public static void main(final String[] args) throws Exception {
        // ── 1. Configuration ──────────────────────────────────────────────────
        final DispatcherConfig config = DispatcherConfig.load();
        LOG.info("=================================================");
        LOG.info("  {}  v{}", config.getServiceName(), config.getServiceVersion());
        LOG.info("=================================================");
        LOG.info("Configuration loaded. Bootstrap: {}, Topics: {}",
                config.getBootstrapServers(), config.getTopics());

        final Clock clock = Clock.systemUTC();
        final ObjectMapper mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        final TemplateResolver templates =
                new ConfigTemplateResolver(config.getTemplates(), config.getDefaultLocale());

        // ── 2. Channel providers ──────────────────────────────────────────────
        final Map<Channel, ChannelProvider> providers = ChannelProviderFactory.build(config);
        if (providers.isEmpty()) {
            LOG.error("No channel providers are configured, refusing to start. "
                    + "Enable at least one email or SMS provider.");
            System.exit(1);
        }

        // ── 3. Core services ──────────────────────────────────────────────────
        final NotificationStateStore stateStore  = new InMemoryNotificationStateStore();
        final IdempotencyStore       idempotency = new InMemoryIdempotencyStore(config, clock);
        final ProviderInvoker        invoker     = new ProviderInvoker(providers, config.getProviderTimeout());
        final DispatchWorkerPool     workers     = new DispatchWorkerPool(config);
        final DispatchEngine         engine      = new DispatchEngine(
                config, stateStore, idempotency, templates, invoker, workers, clock);
        workers.start(engine::processJob);
        final RetryScanner scanner = new RetryScanner(engine, idempotency, config, clock);
        scanner.start();

        final InboundEventParser        parser   = new InboundEventParser(mapper);
        final NotificationEventConsumer consumer = new NotificationEventConsumer(config, engine, parser);
        final KafkaQueueHealthCheck     queueCheck = new KafkaQueueHealthCheck(config);

        // ── 4. Management server ──────────────────────────────────────────────
        final ManagementServer management = new ManagementServer(
                config.getManagementPort(),
                config.getManagementThreads(),
                config.getServiceName(),
                engine,
                stateStore,
                parser,
                List.of(
                        HealthCheck.of("engine", workers::isRunning),
                        queueCheck,
                        HealthCheck.of("state_store", stateStore::isAvailable),
                        HealthCheck.of("idempotency_store", idempotency::isAvailable)),
                mapper);
        management.start();

        // ── 5. Consumer thread ────────────────────────────────────────────────
        final ExecutorService consumerThread = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, "event-consumer");
            t.setDaemon(false);
            return t;
        });
        final CountDownLatch shutdownLatch = new CountDownLatch(1);

        consumerThread.submit(() -> {
            try {
                management.markReady();
                consumer.run();
            } finally {
                management.markNotReady();
                shutdownLatch.countDown();
            }
        });

        // ── 6. Shutdown hook ──────────────────────────────────────────────────
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOG.info("Shutdown hook triggered, starting graceful shutdown...");
            management.markNotReady();

            consumer.shutdown();
            consumerThread.shutdown();
            try {
                if (!consumerThread.awaitTermination(30, TimeUnit.SECONDS)) {
                    LOG.warn("Consumer thread did not terminate in 30s, forcing shutdown");
                    consumerThread.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                consumerThread.shutdownNow();
            }

            scanner.close();
            if (!workers.drain(config.getDrainTimeout())) {
                LOG.warn("Unfinished jobs are left for recovery on the next start");
            }

            invoker.close();
            queueCheck.close();
            stateStore.close();
            idempotency.close();
            management.stop();
            LOG.info("Notification Dispatch Service shut down cleanly.");
        }, "shutdown-hook"));

        LOG.info("Notification Dispatch Service is running. Press Ctrl+C to stop.");
        shutdownLatch.await();
    }
}
