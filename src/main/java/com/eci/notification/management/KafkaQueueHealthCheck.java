package com.eci.notification.management;

import com.eci.notification.config.DispatcherConfig;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.common.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Reports the broker connection as healthy when {@code describeCluster}
 * returns at least one node within {@code kafka.health-timeout}.
 */
public class KafkaQueueHealthCheck implements HealthCheck, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(KafkaQueueHealthCheck.class);

    private final Admin    admin;
    private final Duration timeout;

    public KafkaQueueHealthCheck(final DispatcherConfig config) {
        this(Admin.create(adminProperties(config)), config.getKafkaHealthTimeout());
    }

    KafkaQueueHealthCheck(final Admin admin, final Duration timeout) {
        this.admin   = admin;
        this.timeout = timeout;
    }

    @Override
    public String name() {
        return "queue";
    }

    @Override
    public boolean isHealthy() {
        try {
            final Collection<Node> nodes = admin
                    .describeCluster(new DescribeClusterOptions().timeoutMs((int) timeout.toMillis()))
                    .nodes()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return !nodes.isEmpty();
        } catch (ExecutionException | TimeoutException e) {
            LOG.debug("Kafka health check failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        admin.close(Duration.ofSeconds(5));
    }

    private static Properties adminProperties(final DispatcherConfig config) {
        final Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, config.getBootstrapServers());
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) config.getKafkaHealthTimeout().toMillis());
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) config.getKafkaHealthTimeout().toMillis());
        return props;
    }
}
