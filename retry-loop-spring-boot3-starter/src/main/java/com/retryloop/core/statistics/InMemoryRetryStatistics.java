package com.retryloop.core.statistics;

import com.retryloop.core.spi.RetryStatistics;
import com.retryloop.model.StatisticsSnapshot;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 内存计数
 * 自增与读取走读锁, reset/snapshot 走写锁, 保证清零对读者原子可见
 */
public class InMemoryRetryStatistics implements RetryStatistics {

    private final AtomicLong started = new AtomicLong();
    private final AtomicLong success = new AtomicLong();
    private final AtomicLong exhausted = new AtomicLong();
    private final AtomicLong recovered = new AtomicLong();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public void incrementStarted() { inc(started); }

    @Override
    public void incrementSuccess() { inc(success); }

    @Override
    public void incrementExhausted() { inc(exhausted); }

    @Override
    public void incrementRecovered() { inc(recovered); }

    @Override
    public long getStartedCount() { return read(started); }

    @Override
    public long getSuccessCount() { return read(success); }

    @Override
    public long getExhaustedCount() { return read(exhausted); }

    @Override
    public long getRecoveredCount() { return read(recovered); }

    @Override
    public void reset() {
        lock.writeLock().lock();
        try {
            started.set(0);
            success.set(0);
            exhausted.set(0);
            recovered.set(0);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public StatisticsSnapshot snapshot() {
        lock.writeLock().lock();
        try {
            return new StatisticsSnapshot(started.get(), success.get(), exhausted.get(), recovered.get());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void inc(AtomicLong counter) {
        lock.readLock().lock();
        try {
            counter.incrementAndGet();
        } finally {
            lock.readLock().unlock();
        }
    }

    private long read(AtomicLong counter) {
        lock.readLock().lock();
        try {
            return counter.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public String toString() {
        return snapshot().toString();
    }
}
