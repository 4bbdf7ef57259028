package com.retryloop.model;

import com.retryloop.core.spi.RetryListener;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * 单类操作的重试定义, 构造后不可变
 * 每次执行都由它构建新的 policy / backoff, 不存在共享可变实例
 */
@Getter
@Builder(toBuilder = true)
public final class RetryDefinition {

    /** 最大尝试次数（含首次） */
    @Builder.Default
    private final int maxAttempts = 3;

    /** 可重试异常类型, 为空表示除排除项外全部可重试 */
    @Singular
    private final Set<Class<? extends Throwable>> retryableFailureTypes;

    /** 不可重试异常类型, 优先级高于 retryableFailureTypes */
    @Singular
    private final Set<Class<? extends Throwable>> nonRetryableFailureTypes;

    /** 退避参数 */
    @Builder.Default
    private final Backoff backoff = Backoff.builder().build();

    /** fixed | exponential | spi:{name} */
    @Builder.Default
    private final String backoffStrategy = "exponential";

    /** 标签, 用于匹配恢复处理器及日志 */
    private final String label;

    /** 按顺序通知的监听器 */
    @Singular
    private final List<RetryListener> listeners;

    public static RetryDefinition defaults() {
        return RetryDefinition.builder().build();
    }

    /**
     * 退避参数
     */
    @Getter
    @Builder(toBuilder = true)
    public static final class Backoff {

        /** 初始延迟, fixed 策略下即固定延迟 */
        @Builder.Default
        private final Duration initialDelay = Duration.ofMillis(1000);

        @Builder.Default
        private final double multiplier = 2.0;

        @Builder.Default
        private final Duration maxDelay = Duration.ofMillis(30000);

        /** 是否开启 ±25% 抖动 */
        @Builder.Default
        private final boolean jitter = false;
    }
}
