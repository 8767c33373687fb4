package com.eci.notification.store;

import com.eci.notification.error.StoreUnavailableException;
import com.eci.notification.model.Channel;
import com.eci.notification.model.DeliveryAttempt;
import com.eci.notification.model.ErrorKind;
import com.eci.notification.model.JobState;
import com.eci.notification.model.NotificationJob;
import com.eci.notification.model.ProviderResult;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class InMemoryNotificationStateStoreTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryNotificationStateStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryNotificationStateStore();
    }

    // ── createIfAbsent ────────────────────────────────────────────────────────

    @Test
    void createIfAbsent_returnsExistingActiveJob_forSameDedupKey() {
        final var first  = store.createIfAbsent(job("job-1", "key-a", Channel.EMAIL, T0));
        final var second = store.createIfAbsent(job("job-2", "key-a", Channel.EMAIL, T0.plusSeconds(1)));

        assertThat(second.getJobId()).isEqualTo(first.getJobId());
        assertThat(store.findById("job-2")).isEmpty();
    }

    @Test
    void createIfAbsent_allowsNewJob_onceKeyHolderIsTerminal() {
        final var first = store.createIfAbsent(job("job-1", "key-a", Channel.EMAIL, T0));
        store.update(first.transitionTo(JobState.FAILED, T0).failed(ErrorKind.PERMANENT_FAILURE, "bad").build());

        final var second = store.createIfAbsent(job("job-2", "key-a", Channel.EMAIL, T0.plusSeconds(5)));

        assertThat(second.getJobId()).isEqualTo("job-2");
        assertThat(store.findActiveByDedupKey("key-a")).map(NotificationJob::getJobId).contains("job-2");
        assertThat(store.findLatestByDedupKey("key-a")).map(NotificationJob::getJobId).contains("job-2");
    }

    // ── update / recordAttempt ────────────────────────────────────────────────

    @Test
    void update_rejectsChanges_toTerminalJob() {
        final var created = store.createIfAbsent(job("job-1", "key-a", Channel.EMAIL, T0));
        final var failed  = created.transitionTo(JobState.FAILED, T0).failed(ErrorKind.DUPLICATE, "dup").build();
        store.update(failed);

        assertThatThrownBy(() -> store.update(failed.toBuilder().lastError("again").build()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("cannot change");
    }

    @Test
    void update_rejectsAttemptCountChange() {
        final var created = store.createIfAbsent(job("job-1", "key-a", Channel.EMAIL, T0));

        assertThatThrownBy(() -> store.update(created.toBuilder().attemptCount(1).build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recordAttempt_appendsHistory_andKeepsCountInStep() {
        final var sending = sendingJob("job-1", "key-a");
        final var result  = ProviderResult.builder("sendgrid", Channel.EMAIL).retryable("HTTP 503", 503).build();

        final var retrying = sending.transitionTo(JobState.RETRYING, T0)
                .attemptCount(1).nextRetryAt(T0.plusSeconds(4)).build();
        store.recordAttempt(retrying, new DeliveryAttempt("job-1", 1, result, T0, 12));

        assertThat(store.findAttempts("job-1")).singleElement().satisfies(a -> {
            assertThat(a.getAttemptNo()).isEqualTo(1);
            assertThat(a.getErrorKind()).isEqualTo(ErrorKind.RETRYABLE_FAILURE);
            assertThat(a.getProviderResponseCode()).isEqualTo(503);
        });
        assertThat(store.findById("job-1")).map(NotificationJob::getAttemptCount).contains(1);
    }

    @Test
    void recordAttempt_rejectsOutOfOrderAttemptNumber() {
        final var sending = sendingJob("job-1", "key-a");
        final var result  = ProviderResult.builder("log", Channel.EMAIL).success("m-1", 0).build();
        final var delivered = sending.transitionTo(JobState.DELIVERED, T0).attemptCount(2).build();

        assertThatThrownBy(() -> store.recordAttempt(delivered, new DeliveryAttempt("job-1", 2, result, T0, 1)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("expects attempt #1");
        assertThat(store.findAttempts("job-1")).isEmpty();
    }

    // ── scans ─────────────────────────────────────────────────────────────────

    @Test
    void findDueForRetry_returnsOnlyRetryingJobsWhoseTimeHasCome() {
        final var result = ProviderResult.builder("log", Channel.EMAIL).retryable("x", 0).build();
        final var due    = sendingJob("job-due", "key-a").transitionTo(JobState.RETRYING, T0)
                .attemptCount(1).nextRetryAt(T0.plusSeconds(2)).build();
        final var later  = sendingJob("job-later", "key-b").transitionTo(JobState.RETRYING, T0)
                .attemptCount(1).nextRetryAt(T0.plusSeconds(60)).build();
        store.recordAttempt(due, new DeliveryAttempt("job-due", 1, result, T0, 1));
        store.recordAttempt(later, new DeliveryAttempt("job-later", 1, result, T0, 1));

        assertThat(store.findDueForRetry(T0.plusSeconds(10), 10))
                .extracting(NotificationJob::getJobId)
                .containsExactly("job-due");
    }

    @Test
    void findStale_returnsNonTerminalJobsNotTouchedSinceCutoff() {
        store.createIfAbsent(job("old", "key-a", Channel.EMAIL, T0));
        store.createIfAbsent(job("new", "key-b", Channel.EMAIL, T0.plus(Duration.ofMinutes(10))));
        final var done = store.createIfAbsent(job("done", "key-c", Channel.EMAIL, T0));
        store.update(done.transitionTo(JobState.FAILED, T0).failed(ErrorKind.PERMANENT_FAILURE, "x").build());

        assertThat(store.findStale(T0.plus(Duration.ofMinutes(5)), 10))
                .extracting(NotificationJob::getJobId)
                .containsExactly("old");
    }

    // ── query / stats ─────────────────────────────────────────────────────────

    @Test
    void query_filtersAndOrdersNewestFirst() {
        store.createIfAbsent(job("e1", "k1", Channel.EMAIL, T0));
        store.createIfAbsent(job("s1", "k2", Channel.SMS, T0.plusSeconds(1)));
        store.createIfAbsent(job("e2", "k3", Channel.EMAIL, T0.plusSeconds(2)));

        assertThat(store.query(new JobQuery(null, Channel.EMAIL, null, null, 0)))
                .extracting(NotificationJob::getJobId)
                .containsExactly("e2", "e1");
        assertThat(store.query(new JobQuery(JobState.PENDING, null, "order.confirmed", "evt-s1", 1)))
                .extracting(NotificationJob::getJobId)
                .containsExactly("s1");
        assertThat(store.query(new JobQuery(null, null, null, null, 1, 1)))
                .extracting(NotificationJob::getJobId)
                .containsExactly("s1");
        assertThat(store.query(new JobQuery(null, null, null, null, 10, 3))).isEmpty();
    }

    @Test
    void stats_countsByStateChannelAndType() {
        store.createIfAbsent(job("e1", "k1", Channel.EMAIL, T0));
        final var sms = store.createIfAbsent(job("s1", "k2", Channel.SMS, T0));
        store.update(sms.transitionTo(JobState.FAILED, T0).failed(ErrorKind.PERMANENT_FAILURE, "x").build());

        final var stats = store.stats();

        assertThat(stats.total()).isEqualTo(2);
        assertThat(stats.count(JobState.PENDING)).isEqualTo(1);
        assertThat(stats.count(JobState.FAILED)).isEqualTo(1);
        assertThat(stats.count(JobState.DELIVERED)).isZero();
        assertThat(stats.byChannel()).containsEntry(Channel.EMAIL, 1L).containsEntry(Channel.SMS, 1L);
        assertThat(stats.byEventType()).containsEntry("order.confirmed", 2L);
    }

    @Test
    void operations_failWithStoreUnavailable_afterClose() {
        store.close();

        assertThat(store.isAvailable()).isFalse();
        assertThatThrownBy(() -> store.findById("x")).isInstanceOf(StoreUnavailableException.class);
        assertThatThrownBy(() -> store.stats()).isInstanceOf(StoreUnavailableException.class);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private NotificationJob sendingJob(final String id, final String key) {
        final var created   = store.createIfAbsent(job(id, key, Channel.EMAIL, T0));
        final var rendering = store.update(created.transitionTo(JobState.RENDERING, T0).build());
        return store.update(rendering.transitionTo(JobState.SENDING, T0)
                .templateId("order.confirmed/en").renderedSubject("s").renderedBody("b").build());
    }

    private static NotificationJob job(final String id, final String key, final Channel channel, final Instant at) {
        return NotificationJob.builder()
                .jobId(id)
                .sourceEventId("evt-" + id)
                .eventType("order.confirmed")
                .dedupKey(key)
                .channel(channel)
                .recipient(channel == Channel.EMAIL ? "a@example.com" : "+15551234567")
                .locale("en")
                .createdAt(at)
                .build();
    }
}
