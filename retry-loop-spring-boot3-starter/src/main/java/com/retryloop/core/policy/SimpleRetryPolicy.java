package com.retryloop.core.policy;

import com.retryloop.core.spi.RetryPolicy;
import com.retryloop.model.RetryDefinition;
import com.retryloop.model.ctx.RetryContext;

import java.util.Set;

/**
 * 按尝试次数和异常类型判定
 * - 排除集合优先
 * - 包含集合为空时视为匹配全部（仍受排除集合约束）
 * - 类型匹配按 is-a, 子类同样命中
 */
public class SimpleRetryPolicy implements RetryPolicy {

    private final int maxAttempts;

    private final Set<Class<? extends Throwable>> retryable;

    private final Set<Class<? extends Throwable>> nonRetryable;

    public SimpleRetryPolicy(int maxAttempts,
                             Set<Class<? extends Throwable>> retryable,
                             Set<Class<? extends Throwable>> nonRetryable) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
        this.retryable = Set.copyOf(retryable);
        this.nonRetryable = Set.copyOf(nonRetryable);
    }

    public SimpleRetryPolicy(int maxAttempts) {
        this(maxAttempts, Set.of(), Set.of());
    }

    public static SimpleRetryPolicy from(RetryDefinition definition) {
        return new SimpleRetryPolicy(definition.getMaxAttempts(),
                definition.getRetryableFailureTypes(),
                definition.getNonRetryableFailureTypes());
    }

    @Override
    public boolean canRetry(RetryContext context) {
        return context.getAttemptCount() < maxAttempts;
    }

    @Override
    public boolean shouldRetry(Throwable failure, RetryContext context) {
        if (!canRetry(context)) {
            return false;
        }
        if (matchesAny(nonRetryable, failure)) {
            return false;
        }
        return retryable.isEmpty() || matchesAny(retryable, failure);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    private static boolean matchesAny(Set<Class<? extends Throwable>> types, Throwable failure) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(failure)) {
                return true;
            }
        }
        return false;
    }
}
