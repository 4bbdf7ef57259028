package com.retryloop.core.engine;

import com.retryloop.core.backoff.FixedBackoffPolicy;
import com.retryloop.core.spi.*;
import com.retryloop.core.statistics.InMemoryRetryStatistics;
import com.retryloop.exception.RetryExhaustedException;
import com.retryloop.exception.RetryInterruptedException;
import com.retryloop.model.ctx.RetryContext;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 重试执行器核心循环
 * OPEN -> (ATTEMPTING -> SUCCEEDED | FAILED -> RETRY | EXHAUSTED) -> CLOSED
 * - onOpen 最先且只触发一次, onClose 最后且只触发一次（无论成功、耗尽、恢复或恢复失败）
 * - 同一次执行内的尝试严格串行
 * - 实例不可变, 可被并发执行共享; 上下文不可共享
 */
@Getter
public class DefaultRetryExecutor implements RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(DefaultRetryExecutor.class);

    private final RetryPolicy retryPolicy;

    private final BackoffPolicy backoffPolicy;

    private final List<RetryListener> listeners;

    private final RetryStatistics statistics;

    private final Sleeper sleeper;

    @Builder
    public DefaultRetryExecutor(RetryPolicy retryPolicy,
                                BackoffPolicy backoffPolicy,
                                @Singular List<RetryListener> listeners,
                                RetryStatistics statistics,
                                Sleeper sleeper) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.backoffPolicy = backoffPolicy == null ? new FixedBackoffPolicy(Duration.ZERO) : backoffPolicy;
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
        this.statistics = statistics == null ? new InMemoryRetryStatistics() : statistics;
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    @Override
    public <T> T execute(RetryCallback<T> callback, RecoveryCallback<T> recovery, RetryContext context) throws Exception {
        Objects.requireNonNull(callback, "callback");
        Objects.requireNonNull(context, "context");

        statistics.incrementStarted();
        fireOpen(context);

        Throwable closeFailure = null;
        try {
            while (true) {
                if (context.getAttemptCount() > 0) {
                    fireRetry(context);
                    backoff(context);
                }

                T result;
                try {
                    result = callback.doWithRetry(context);
                } catch (InterruptedException ie) {
                    // 操作内部被中断, 按取消处理, 不再重试
                    Thread.currentThread().interrupt();
                    throw new RetryInterruptedException(context, ie);
                } catch (Exception e) {
                    context.registerFailure(e);
                    log.trace("[Retry-Executor] name={} attempt {} failed: {}", context.getName(),
                            context.getAttemptCount(), e.toString());
                    fireError(context, e);

                    if (!retryPolicy.shouldRetry(e, context)) {
                        log.trace("[Retry-Executor] name={} not retryable for {}", context.getName(), e.getClass().getName());
                        break;
                    }
                    if (!retryPolicy.canRetry(context)) {
                        log.trace("[Retry-Executor] name={} exhausted after {} attempts", context.getName(),
                                context.getAttemptCount());
                        break;
                    }
                    continue;
                }

                statistics.incrementSuccess();
                return result;
            }

            // 重试耗尽
            statistics.incrementExhausted();
            closeFailure = context.getLastFailure();
            if (recovery != null && !recovery.canRecover(context)) {
                log.debug("[Retry-Executor] name={} recovery does not accept {}", context.getName(),
                        context.getLastFailure() == null ? null : context.getLastFailure().getClass().getName());
            } else if (recovery != null) {
                log.debug("[Retry-Executor] name={} invoking recovery after {} failed attempts",
                        context.getName(), context.getAttemptCount());
                statistics.incrementRecovered();
                return recovery.recover(context);
            }
        } catch (Throwable t) {
            closeFailure = t;
            throw t;
        } finally {
            fireClose(context, closeFailure);
        }
        throw new RetryExhaustedException(context);
    }

    private void backoff(RetryContext context) {
        Duration delay = backoffPolicy.computeBackoff(context);
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        log.trace("[Retry-Executor] name={} sleeping {}ms before attempt {}", context.getName(),
                delay.toMillis(), context.getAttemptCount() + 1);
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new RetryInterruptedException(context, ie);
        }
    }

    private void fireOpen(RetryContext context) {
        for (RetryListener l : listeners) {
            try {
                l.onOpen(context);
            } catch (RuntimeException e) {
                log.warn("[Retry-Executor] listener {} onOpen failed", l.getClass().getName(), e);
            }
        }
    }

    private void fireRetry(RetryContext context) {
        for (RetryListener l : listeners) {
            try {
                l.onRetry(context);
            } catch (RuntimeException e) {
                log.warn("[Retry-Executor] listener {} onRetry failed", l.getClass().getName(), e);
            }
        }
    }

    private void fireError(RetryContext context, Throwable failure) {
        for (RetryListener l : listeners) {
            try {
                l.onError(context, failure);
            } catch (RuntimeException e) {
                log.warn("[Retry-Executor] listener {} onError failed", l.getClass().getName(), e);
            }
        }
    }

    private void fireClose(RetryContext context, Throwable lastFailure) {
        for (RetryListener l : listeners) {
            try {
                l.onClose(context, lastFailure);
            } catch (RuntimeException e) {
                log.warn("[Retry-Executor] listener {} onClose failed", l.getClass().getName(), e);
            }
        }
    }
}
