package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

/**
 * 重试耗尽后的兜底, 可从 context 取得最后一次失败和尝试次数
 */
@FunctionalInterface
public interface RecoveryCallback<T> {

    T recover(RetryContext context) throws Exception;

    /**
     * 能否处理本次实际的最后一次失败; 返回 false 时按无恢复处理
     */
    default boolean canRecover(RetryContext context) {
        return true;
    }
}
