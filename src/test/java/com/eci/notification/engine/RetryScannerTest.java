package com.eci.notification.engine;

import com.eci.notification.TestClock;
import com.eci.notification.config.DispatcherConfig;
import com.eci.notification.error.StoreUnavailableException;
import com.eci.notification.store.IdempotencyStore;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryScannerTest {

    @Mock private DispatchEngine   engine;
    @Mock private IdempotencyStore idempotency;

    private final TestClock clock = new TestClock(Instant.parse("2024-05-01T10:00:00Z"));
    private RetryScanner scanner;

    @BeforeEach
    void setup() {
        scanner = new RetryScanner(engine, idempotency, DispatcherConfig.load(), clock);
    }

    @AfterEach
    void teardown() {
        scanner.close();
    }

    @Test
    void scan_recoversStaleJobs_thenQueuesDueRetries() {
        scanner.scan();

        final var order = inOrder(engine);
        order.verify(engine).recoverStaleJobs(clock.instant());
        order.verify(engine).enqueueDueJobs(clock.instant());
    }

    @Test
    void scan_keepsRunning_whenStoreFails() {
        when(engine.recoverStaleJobs(any())).thenThrow(new StoreUnavailableException("State store is closed"));

        assertThatCode(() -> scanner.scan()).doesNotThrowAnyException();
        verify(engine, never()).enqueueDueJobs(any());
    }

    @Test
    void purge_logsStoreErrors_insteadOfThrowing() {
        when(idempotency.purgeExpired()).thenThrow(new StoreUnavailableException("Idempotency store is closed"));

        assertThatCode(() -> scanner.purge()).doesNotThrowAnyException();
        verify(idempotency).purgeExpired();
    }
}
