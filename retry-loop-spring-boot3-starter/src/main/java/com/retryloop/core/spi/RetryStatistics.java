package com.retryloop.core.spi;

import com.retryloop.model.StatisticsSnapshot;

/**
 * 跨执行聚合的统计计数
 * 可被并发执行共享, 实现必须线程安全
 */
public interface RetryStatistics {

    void incrementStarted();

    void incrementSuccess();

    void incrementExhausted();

    void incrementRecovered();

    long getStartedCount();

    long getSuccessCount();

    long getExhaustedCount();

    long getRecoveredCount();

    /**
     * 四个计数一起清零
     */
    void reset();

    StatisticsSnapshot snapshot();
}
