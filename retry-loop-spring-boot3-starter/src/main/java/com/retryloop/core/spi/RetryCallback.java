package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 被重试的操作
 */
@FunctionalInterface
public interface RetryCallback<T> {

    T doWithRetry(RetryContext context) throws Exception;
}
