package com.eci.notification.management;

import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.DescribeClusterOptions;
import org.apache.kafka.clients.admin.DescribeClusterResult;
import org.apache.kafka.common.KafkaFuture;
import org.apache.kafka.common.Node;
import org.apache.kafka.common.errors.TimeoutException;
import org.apache.kafka.common.internals.KafkaFutureImpl;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KafkaQueueHealthCheckTest {

    @Mock private Admin                 admin;
    @Mock private DescribeClusterResult cluster;

    private KafkaQueueHealthCheck check;

    @BeforeEach
    void setup() {
        when(admin.describeCluster(any(DescribeClusterOptions.class))).thenReturn(cluster);
        check = new KafkaQueueHealthCheck(admin, Duration.ofMillis(200));
    }

    @Test
    void isHealthy_whenClusterReportsNodes() {
        when(cluster.nodes()).thenReturn(
                KafkaFuture.<Collection<Node>>completedFuture(List.of(new Node(1, "broker-1", 9092))));

        assertThat(check.isHealthy()).isTrue();
        assertThat(check.name()).isEqualTo("queue");
    }

    @Test
    void isUnhealthy_whenClusterHasNoNodes() {
        when(cluster.nodes()).thenReturn(KafkaFuture.<Collection<Node>>completedFuture(List.of()));

        assertThat(check.isHealthy()).isFalse();
    }

    @Test
    void isUnhealthy_whenDescribeFails() {
        final KafkaFutureImpl<Collection<Node>> failed = new KafkaFutureImpl<>();
        failed.completeExceptionally(new TimeoutException("Timed out waiting for a node assignment"));
        when(cluster.nodes()).thenReturn(failed);

        assertThat(check.isHealthy()).isFalse();
    }

    @Test
    void isUnhealthy_whenBrokerDoesNotAnswerInTime() {
        when(cluster.nodes()).thenReturn(new KafkaFutureImpl<>());

        assertThat(check.isHealthy()).isFalse();
    }
}
