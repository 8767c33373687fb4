package com.eci.notification.retry;

import com.eci.notification.config.DispatcherConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential back-off with jitter for provider retries.
 *
 * <h2>Formula</h2>
 * <pre>
 *   raw(n)   = min(base × 2^n, max)
 *   delay(n) = min(raw(n) + jitter, max)
 *   jitter   = random(0, jitterRatio × raw(n))
 * </pre>
 * where {@code n} is the job's attempt count after the failed attempt.
 * With a jitter ratio below 1 the sequence is non-decreasing in {@code n}
 * and never exceeds {@code max}.
 */
public class BackoffPolicy {

    private final long           baseMs;
    private final long           maxMs;
    private final double         jitterRatio;
    private final DoubleSupplier random;

    public BackoffPolicy(final DispatcherConfig config) {
        this(config.getRetryBaseDelay(), config.getRetryMaxDelay(), config.getRetryJitterRatio(),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    public BackoffPolicy(
            final Duration base,
            final Duration max,
            final double jitterRatio,
            final DoubleSupplier random) {
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("retry.base-delay must be positive");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("retry.max-delay must not be smaller than retry.base-delay");
        }
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("retry.jitter-ratio must be in [0, 1)");
        }
        this.baseMs      = base.toMillis();
        this.maxMs       = max.toMillis();
        this.jitterRatio = jitterRatio;
        this.random      = random;
    }

    /**
     * Delay before the next attempt of a job that has made
     * {@code attemptCount} attempts so far.
     */
    public Duration delay(final int attemptCount) {
        final long raw    = rawDelayMs(Math.max(0, attemptCount));
        final long jitter = (long) (random.getAsDouble() * jitterRatio * raw);
        return Duration.ofMillis(Math.min(raw + jitter, maxMs));
    }

    public Duration maxDelay() {
        return Duration.ofMillis(maxMs);
    }

    private long rawDelayMs(final int n) {
        // 2^62 already overflows any sane base; cap the exponent first
        if (n >= 62) return maxMs;
        final long factor = 1L << n;
        if (baseMs > maxMs / factor) return maxMs;
        return Math.min(baseMs * factor, maxMs);
    }
}
