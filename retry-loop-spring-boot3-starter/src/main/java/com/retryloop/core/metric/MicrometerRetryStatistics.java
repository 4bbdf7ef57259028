package com.retryloop.core.metric;

import com.retryloop.core.spi.RetryStatistics;
import com.retryloop.core.statistics.InMemoryRetryStatistics;
import com.retryloop.model.StatisticsSnapshot;

/**
 * 计数同时写入 Micrometer
 * Micrometer 计数器不可清零, 读取与 reset 由内存计数负责
 */
public class MicrometerRetryStatistics implements RetryStatistics {

    private final RetryStatistics delegate;

    private final RetryMetrics metrics;

    public MicrometerRetryStatistics(RetryMetrics metrics) {
        this(new InMemoryRetryStatistics(), metrics);
    }

    public MicrometerRetryStatistics(RetryStatistics delegate, RetryMetrics metrics) {
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public void incrementStarted() {
        delegate.incrementStarted();
        metrics.incStarted();
    }

    @Override
    public void incrementSuccess() {
        delegate.incrementSuccess();
        metrics.incSuccess();
    }

    @Override
    public void incrementExhausted() {
        delegate.incrementExhausted();
        metrics.incExhausted();
    }

    @Override
    public void incrementRecovered() {
        delegate.incrementRecovered();
        metrics.incRecovered();
    }

    @Override
    public long getStartedCount() { return delegate.getStartedCount(); }

    @Override
    public long getSuccessCount() { return delegate.getSuccessCount(); }

    @Override
    public long getExhaustedCount() { return delegate.getExhaustedCount(); }

    @Override
    public long getRecoveredCount() { return delegate.getRecoveredCount(); }

    @Override
    public void reset() { delegate.reset(); }

    @Override
    public StatisticsSnapshot snapshot() { return delegate.snapshot(); }
}
