package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 重试生命周期监听器, 只观察不影响流程
 * 被多个并发执行共享时, 实现需自行保证线程安全
 */
public interface RetryListener {

    /** 执行开始, 每次执行触发一次且最先触发 */
    default void onOpen(RetryContext context) {
    }

    /** 非首次尝试之前 */
    default void onRetry(RetryContext context) {
    }

    /** 每次失败的尝试之后 */
    default void onError(RetryContext context, Throwable failure) {
    }

    /**
     * 执行结束, 每次执行触发一次且最后触发
     * @param lastFailure 成功时为 null
     */
    default void onClose(RetryContext context, Throwable lastFailure) {
    }
}
