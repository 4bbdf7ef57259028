package com.retryloop.core.backoff;

import com.retryloop.core.spi.BackoffPolicy;

import java.time.Duration;
import java.util.Objects;

/**
 * 固定间隔策略, 与尝试次数无关
 */
public class FixedBackoffPolicy implements BackoffPolicy {

    private final Duration delay;

    public FixedBackoffPolicy(Duration delay) {
        Objects.requireNonNull(delay, "delay");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("retry.backoff.delay must be >= 0");
        }
        this.delay = delay;
    }

    public static FixedBackoffPolicy ofMillis(long delayMs) {
        return new FixedBackoffPolicy(Duration.ofMillis(delayMs));
    }

    @Override
    public Duration computeBackoff(int attemptCount) {
        return delay;
    }

    public Duration getDelay() {
        return delay;
    }
}
