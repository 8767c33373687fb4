package com.eci.notification.retry;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class BackoffPolicyTest {

    private static final Duration BASE = Duration.ofSeconds(2);
    private static final Duration MAX  = Duration.ofMinutes(10);

    @Test
    void delay_doublesPerAttempt_withoutJitter() {
        final var policy = new BackoffPolicy(BASE, MAX, 0.0, () -> 0.5);

        assertThat(policy.delay(0)).isEqualTo(Duration.ofSeconds(2));
        assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(4));
        assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(8));
        assertThat(policy.delay(5)).isEqualTo(Duration.ofSeconds(64));
    }

    @Test
    void delay_isCappedAtMax_evenForHugeAttemptCounts() {
        final var policy = new BackoffPolicy(BASE, MAX, 0.2, () -> 0.999);

        assertThat(policy.delay(9)).isEqualTo(MAX);
        assertThat(policy.delay(40)).isEqualTo(MAX);
        assertThat(policy.delay(Integer.MAX_VALUE)).isEqualTo(MAX);
    }

    @Test
    void jitter_staysWithinRatioOfRawDelay() {
        final var low  = new BackoffPolicy(BASE, MAX, 0.2, () -> 0.0);
        final var high = new BackoffPolicy(BASE, MAX, 0.2, () -> 0.999999);

        assertThat(low.delay(3)).isEqualTo(Duration.ofSeconds(16));
        assertThat(high.delay(3)).isBetween(Duration.ofSeconds(16), Duration.ofMillis(19_200));
    }

    @Test
    void delay_isNonDecreasing_forWorstCaseJitter() {
        // maximum jitter on n, minimum on n+1
        final var maxJitter = new BackoffPolicy(BASE, MAX, 0.2, () -> 0.999999);
        final var minJitter = new BackoffPolicy(BASE, MAX, 0.2, () -> 0.0);

        for (int n = 0; n < 30; n++) {
            assertThat(minJitter.delay(n + 1)).as("attempt %d", n)
                    .isGreaterThanOrEqualTo(maxJitter.delay(n));
            assertThat(maxJitter.delay(n)).isLessThanOrEqualTo(MAX);
        }
    }

    @Test
    void constructor_rejectsInvalidSettings() {
        assertThatThrownBy(() -> new BackoffPolicy(Duration.ZERO, MAX, 0.2, () -> 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(MAX, BASE, 0.2, () -> 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BackoffPolicy(BASE, MAX, 1.0, () -> 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
