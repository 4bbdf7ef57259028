package com.retryloop.core.spi;

import com.retryloop.model.ctx.RetryContext;

import java.time.Duration;

/**
 * 退避策略（计算下一次尝试前的等待时间）
 * 实现必须是关于 (attemptCount, 配置) 的纯函数, 配置在构造时固定
 */
public interface BackoffPolicy {

    /**
     * @param attemptCount 已登记的失败次数
     * @return 等待时长, 不为负, ZERO 表示立即重试
     */
    Duration computeBackoff(int attemptCount);

    default Duration computeBackoff(RetryContext context) {
        return computeBackoff(context.getAttemptCount());
    }
}
