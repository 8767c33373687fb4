package com.eci.notification.consumer;

import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.engine.DispatchEngine;
import com.eci.notification.engine.Submission;
import com.eci.notification.error.ValidationException;
import com.eci.notification.model.Event;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Kafka consumer loop feeding the {@link DispatchEngine}.
 *
 * <p>Subscribes to the e-commerce event topics, parses each record into an
 * {@link com.eci.notification.model.Event} and submits it.
 *
 * <h2>Offset management</h2>
 * A record's offset is committed only after every job it produced is
 * persisted, so a crash before the commit redelivers the record and the
 * engine's deduplication absorbs the repeat.
 *
 * <h2>Error handling</h2>
 * <ul>
 *   <li>Malformed JSON and invalid events: logged and committed.</li>
 *   <li>Any other failure (e.g. the state store is down): the partition is
 *       rewound to the failed record and paused for
 *       {@code kafka.pause-on-failure}, then redelivered.</li>
 *   <li>{@link WakeupException}: clean shutdown signal from {@link #shutdown()}.</li>
 * </ul>
 */
public class NotificationEventConsumer implements Runnable, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationEventConsumer.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

    private final Consumer<String, String>  consumer;
    private final DispatchEngine            engine;
    private final InboundEventParser        parser;
    private final List<String>              topics;
    private final Duration                  pauseOnFailure;
    private final AtomicBoolean             running = new AtomicBoolean(false);
    private final Map<TopicPartition, Long> pausedUntil = new HashMap<>();

    private final AtomicLong totalReceived  = new AtomicLong();
    private final AtomicLong totalSubmitted = new AtomicLong();
    private final AtomicLong totalInvalid   = new AtomicLong();
    private final AtomicLong totalDeferred  = new AtomicLong();

    public NotificationEventConsumer(
            final DispatcherConfig config,
            final DispatchEngine engine,
            final InboundEventParser parser) {
        this(new KafkaConsumer<>(buildKafkaProperties(config)), engine, parser,
                config.getTopics(), config.getPauseOnFailure());
    }

    NotificationEventConsumer(
            final Consumer<String, String> consumer,
            final DispatchEngine engine,
            final InboundEventParser parser,
            final List<String> topics,
            final Duration pauseOnFailure) {
        this.consumer       = consumer;
        this.engine         = engine;
        this.parser         = parser;
        this.topics         = List.copyOf(topics);
        this.pauseOnFailure = pauseOnFailure;
    }

    @Override
    public void run() {
        running.set(true);
        consumer.subscribe(topics);
        LOG.info("Event consumer started, subscribed to {} topics: {}", topics.size(), topics);

        try {
            while (running.get()) {
                resumeExpiredPauses();
                final ConsumerRecords<String, String> records = consumer.poll(POLL_TIMEOUT);
                for (final TopicPartition partition : records.partitions()) {
                    processPartition(partition, records.records(partition));
                }
            }
        } catch (WakeupException e) {
            if (running.get()) {
                LOG.error("Unexpected WakeupException while still running", e);
            } else {
                LOG.debug("Consumer woken up for shutdown");
            }
        } catch (Exception e) {
            LOG.error("Fatal error in consumer loop", e);
        } finally {
            running.set(false);
            consumer.close();
            LOG.info("Consumer closed. Stats: received={} submitted={} invalid={} deferred={}",
                    totalReceived.get(), totalSubmitted.get(), totalInvalid.get(), totalDeferred.get());
        }
    }

    /** Signal the consumer loop to stop on the next poll boundary. */
    public void shutdown() {
        running.set(false);
        consumer.wakeup();
        LOG.info("Shutdown signal sent to event consumer");
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    // ── Private ───────────────────────────────────────────────────────────────

    private void processPartition(
            final TopicPartition partition,
            final List<ConsumerRecord<String, String>> records) {
        long nextOffset = -1;
        for (final ConsumerRecord<String, String> record : records) {
            if (!processRecord(record)) {
                consumer.seek(partition, record.offset());
                consumer.pause(List.of(partition));
                pausedUntil.put(partition, System.nanoTime() + pauseOnFailure.toNanos());
                totalDeferred.incrementAndGet();
                LOG.warn("Paused {} at offset {} for {}", partition, record.offset(), pauseOnFailure);
                break;
            }
            nextOffset = record.offset() + 1;
        }
        if (nextOffset >= 0) {
            commit(partition, nextOffset);
        }
    }

    /**
     * @return {@code true} if the record is done with (submitted or
     *         rejected), {@code false} if it must be redelivered
     */
    private boolean processRecord(final ConsumerRecord<String, String> record) {
        totalReceived.incrementAndGet();
        final String fallbackId = record.topic() + ":" + record.partition() + ":" + record.offset();
        try {
            final Event event = parser.parse(record.value(), fallbackId);
            final List<Submission> submissions = engine.submit(event);
            totalSubmitted.incrementAndGet();
            LOG.info("Event submitted: eventId={} type={} topic={} jobs={}",
                    event.getEventId(), event.getEventType(), record.topic(), summarize(submissions));
            return true;
        } catch (ValidationException e) {
            totalInvalid.incrementAndGet();
            LOG.warn("Invalid event skipped: topic={} partition={} offset={} error={}",
                    record.topic(), record.partition(), record.offset(), e.getMessage());
            return true;
        } catch (RuntimeException e) {
            LOG.error("Event could not be submitted: topic={} partition={} offset={} error={}",
                    record.topic(), record.partition(), record.offset(), e.getMessage(), e);
            return false;
        }
    }

    private void commit(final TopicPartition partition, final long nextOffset) {
        try {
            consumer.commitSync(Map.of(partition, new OffsetAndMetadata(nextOffset)));
        } catch (WakeupException e) {
            throw e;
        } catch (KafkaException e) {
            // uncommitted records are redelivered and deduplicated by the engine
            LOG.warn("Offset commit failed for {} at {}: {}", partition, nextOffset, e.getMessage());
        }
    }

    private void resumeExpiredPauses() {
        if (pausedUntil.isEmpty()) return;
        final long now = System.nanoTime();
        final Set<TopicPartition> assigned = consumer.assignment();
        final List<TopicPartition> resume = new ArrayList<>();
        pausedUntil.entrySet().removeIf(e -> {
            if (!assigned.contains(e.getKey())) return true;
            if (now - e.getValue() >= 0) {
                resume.add(e.getKey());
                return true;
            }
            return false;
        });
        if (!resume.isEmpty()) {
            consumer.resume(resume);
            LOG.info("Resumed partitions {}", resume);
        }
    }

    private static String summarize(final List<Submission> submissions) {
        final StringBuilder sb = new StringBuilder("[");
        for (final Submission s : submissions) {
            if (sb.length() > 1) sb.append(", ");
            sb.append(s.channel()).append('=').append(s.status());
        }
        return sb.append(']').toString();
    }

    private static Properties buildKafkaProperties(final DispatcherConfig cfg) {
        final Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG,     cfg.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG,              cfg.getConsumerGroupId());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG,     cfg.getAutoOffsetReset());
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG,      cfg.getMaxPollRecords());
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG,    cfg.getSessionTimeoutMs());
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, cfg.getHeartbeatIntervalMs());
        // offsets are committed by hand once jobs are persisted
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "false");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,   StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        return props;
    }
}
