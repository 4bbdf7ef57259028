package com.retryloop.core.listener;

import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.spi.RetryListener;
import com.retryloop.model.ctx.RetryContext;

/**
 * 记录失败次数分布与执行耗时
 * 起始时间存放在上下文属性中, 共享实例也是无状态的
 */
public class MetricsRetryListener implements RetryListener {

    static final String START_NANOS = MetricsRetryListener.class.getName() + ".startNanos";

    private final RetryMetrics metrics;

    public MetricsRetryListener(RetryMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onOpen(RetryContext context) {
        context.setAttribute(START_NANOS, System.nanoTime());
    }

    @Override
    public void onError(RetryContext context, Throwable failure) {
        metrics.incError();
    }

    @Override
    public void onClose(RetryContext context, Throwable lastFailure) {
        metrics.recordAttempts(context.getAttemptCount());
        if (context.getAttribute(START_NANOS) instanceof Long start) {
            metrics.recordExecNanos(System.nanoTime() - start);
        }
    }
}
