package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 重试执行器
 */
public interface RetryExecutor {

    /**
     * 执行操作, 按策略重试, 耗尽后执行 recovery 或抛出 RetryExhaustedException
     * @param callback 操作
     * @param recovery 兜底, 可为 null
     * @param context  本次执行独占的上下文
     * @throws Exception recovery 自身抛出的异常原样透传
     */
    <T> T execute(RetryCallback<T> callback, RecoveryCallback<T> recovery, RetryContext context) throws Exception;
}
