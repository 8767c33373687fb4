package com.eci.notification.store;

import com.eci.notification.TestClock;
import com.eci.notification.error.StoreUnavailableException;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.*;

class InMemoryIdempotencyStoreTest {

    private static final Duration RETENTION = Duration.ofDays(7);
    private static final Duration LEASE     = Duration.ofSeconds(150);

    private final TestClock clock = new TestClock(Instant.parse("2024-05-01T10:00:00Z"));
    private InMemoryIdempotencyStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryIdempotencyStore(clock, RETENTION, LEASE);
    }

    @Test
    void checkAndReserve_returnsFresh_forUnknownKey() {
        final var reservation = store.checkAndReserve("k", "job-1");

        assertThat(reservation.status()).isEqualTo(Reservation.Status.FRESH);
        assertThat(store.find("k")).hasValueSatisfying(r -> {
            assertThat(r.isDelivered()).isFalse();
            assertThat(r.getExpiresAt()).isEqualTo(clock.instant().plus(LEASE));
        });
    }

    @Test
    void checkAndReserve_reportsHolder_whileLeaseIsLive() {
        store.checkAndReserve("k", "job-1");

        assertThat(store.checkAndReserve("k", "job-2")).isEqualTo(Reservation.inFlight("job-1"));
        assertThat(store.checkAndReserve("k", "job-1")).isEqualTo(Reservation.inFlight("job-1"));
    }

    @Test
    void checkAndReserve_takesOverExpiredLease() {
        store.checkAndReserve("k", "job-1");
        clock.advance(LEASE);

        assertThat(store.checkAndReserve("k", "job-2")).isEqualTo(Reservation.fresh("job-2"));
    }

    @Test
    void markDelivered_blocksKeyUntilRetentionExpires() {
        store.checkAndReserve("k", "job-1");
        store.markDelivered("k", "job-1");

        assertThat(store.checkAndReserve("k", "job-2")).isEqualTo(Reservation.delivered("job-1"));

        clock.advance(RETENTION.plusSeconds(1));
        assertThat(store.find("k")).isEmpty();
        assertThat(store.checkAndReserve("k", "job-2").status()).isEqualTo(Reservation.Status.FRESH);
    }

    @Test
    void release_onlyDropsCallersLease() {
        store.checkAndReserve("k", "job-1");

        store.release("k", "job-2");
        assertThat(store.find("k")).isPresent();

        store.release("k", "job-1");
        assertThat(store.find("k")).isEmpty();
    }

    @Test
    void release_neverDropsDeliveredRecord() {
        store.markDelivered("k", "job-1");
        store.release("k", "job-1");

        assertThat(store.find("k")).hasValueSatisfying(r -> assertThat(r.isDelivered()).isTrue());
    }

    @Test
    void purgeExpired_removesOnlyExpiredRecords() {
        store.checkAndReserve("lease", "job-1");
        store.markDelivered("done", "job-2");
        clock.advance(Duration.ofHours(1));

        assertThat(store.purgeExpired()).isEqualTo(1);
        assertThat(store.find("done")).isPresent();
    }

    @Test
    void checkAndReserve_grantsExactlyOneFreshReservation_underContention() throws Exception {
        final int threads = 16;
        final var pool  = Executors.newFixedThreadPool(threads);
        final var start = new CountDownLatch(1);
        final List<Future<Reservation>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            final String jobId = "job-" + i;
            final Callable<Reservation> task = () -> {
                start.await();
                return store.checkAndReserve("hot", jobId);
            };
            futures.add(pool.submit(task));
        }
        start.countDown();

        int fresh = 0;
        for (final Future<Reservation> f : futures) {
            if (f.get().status() == Reservation.Status.FRESH) fresh++;
        }
        pool.shutdown();

        assertThat(fresh).isEqualTo(1);
    }

    @Test
    void operations_failWithStoreUnavailable_afterClose() {
        store.close();

        assertThat(store.isAvailable()).isFalse();
        assertThatThrownBy(() -> store.checkAndReserve("k", "job-1"))
                .isInstanceOf(StoreUnavailableException.class);
    }
}
