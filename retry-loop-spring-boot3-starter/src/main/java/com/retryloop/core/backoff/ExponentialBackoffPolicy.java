package com.retryloop.core.backoff;

import com.retryloop.core.spi.BackoffPolicy;
import com.retryloop.model.RetryDefinition;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * 指数退避（可选 ±25% 抖动）
 * attempt <= 0 -> 0
 * attempt >= 1 -> initialDelay * multiplier^(min(attempt,31) - 1), 截断到 [0, maxDelay]
 */
public class ExponentialBackoffPolicy implements BackoffPolicy {

    /** 抖动比例 */
    public static final double JITTER_RATIO = 0.25;

    /** 防止幂运算溢出 */
    private static final int MAX_EXPONENT = 31;

    private final long initialDelayMs;

    private final double multiplier;

    private final long maxDelayMs;

    private final boolean jitter;

    /** [0,1) 均匀随机源 */
    private final DoubleSupplier random;

    public ExponentialBackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay, boolean jitter) {
        this(initialDelay, multiplier, maxDelay, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoffPolicy(Duration initialDelay, double multiplier, Duration maxDelay, boolean jitter,
                             DoubleSupplier random) {
        if (initialDelay.isNegative()) {
            throw new IllegalArgumentException("retry.backoff.delay must be >= 0");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("retry.backoff.multiplier must be >= 1.0");
        }
        if (maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("retry.backoff.max-delay must be >= retry.backoff.delay");
        }
        this.initialDelayMs = initialDelay.toMillis();
        this.multiplier = multiplier;
        this.maxDelayMs = maxDelay.toMillis();
        this.jitter = jitter;
        this.random = random;
    }

    public static ExponentialBackoffPolicy from(RetryDefinition.Backoff backoff) {
        return new ExponentialBackoffPolicy(backoff.getInitialDelay(), backoff.getMultiplier(),
                backoff.getMaxDelay(), backoff.isJitter());
    }

    @Override
    public Duration computeBackoff(int attemptCount) {
        if (attemptCount <= 0) {
            return Duration.ZERO;
        }
        int exp = Math.min(attemptCount, MAX_EXPONENT);
        double delay = initialDelayMs * Math.pow(multiplier, exp - 1);

        if (jitter) {
            // [1 - J, 1 + J)
            double factor = 1.0 + JITTER_RATIO * (random.getAsDouble() * 2 - 1);
            delay *= factor;
        }
        long clamped = (long) Math.max(0, Math.min(delay, (double) maxDelayMs));
        return Duration.ofMillis(clamped);
    }
}
