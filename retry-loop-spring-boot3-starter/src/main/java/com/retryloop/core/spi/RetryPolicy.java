package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 重试判定策略
 */
public interface RetryPolicy {

    /**
     * 尝试次数是否仍有余量
     */
    boolean canRetry(RetryContext context);

    /**
     * 给定失败是否应重试, 先判断 canRetry 再按异常类型匹配
     * @param failure 本次尝试抛出的异常
     * @param context 当前执行上下文
     * @return true=可重试
     */
    boolean shouldRetry(Throwable failure, RetryContext context);
}
