package com.retryloop.core.engine;

import com.retryloop.core.RetryOperations;
import com.retryloop.core.backoff.BackoffRegistry;
import com.retryloop.core.policy.SimpleRetryPolicy;
import com.retryloop.core.recovery.DescriptorRecoveryCallback;
import com.retryloop.core.recovery.RecoveryRegistry;
import com.retryloop.core.spi.*;
import com.retryloop.core.spi.notify.AttemptNotifier;
import com.retryloop.exception.RetryExhaustedException;
import com.retryloop.model.AttemptEvent;
import com.retryloop.model.OperationSignature;
import com.retryloop.model.RecoveryDescriptor;
import com.retryloop.model.RetryDefinition;
import com.retryloop.model.ctx.RetryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * "带重试执行" 入口
 * 每次调用都从 RetryDefinition 新建 context / policy / backoff, 共享的只有统计、监听器和通知器
 */
public class RetryTemplate implements RetryOperations {

    private static final Logger log = LoggerFactory.getLogger(RetryTemplate.class);

    /** 退避策略注册中心 */
    private final BackoffRegistry backoffRegistry;

    /** 统计 */
    private final RetryStatistics statistics;

    /** 恢复处理器选择 */
    private final RecoveryResolver recoveryResolver;

    /** 按作用域登记的恢复处理器 */
    private final RecoveryRegistry recoveryRegistry;

    /** 尝试通知 */
    private final AttemptNotifier notifier;

    /** 全局监听器, 先于定义中的监听器触发 */
    private final List<RetryListener> globalListeners;

    /** 退避等待 */
    private final Sleeper sleeper;

    public RetryTemplate(BackoffRegistry backoffRegistry,
                         RetryStatistics statistics,
                         RecoveryResolver recoveryResolver,
                         RecoveryRegistry recoveryRegistry,
                         AttemptNotifier notifier,
                         List<RetryListener> globalListeners,
                         Sleeper sleeper) {
        this.backoffRegistry = Objects.requireNonNull(backoffRegistry, "backoffRegistry");
        this.statistics = Objects.requireNonNull(statistics, "statistics");
        this.recoveryResolver = Objects.requireNonNull(recoveryResolver, "recoveryResolver");
        this.recoveryRegistry = recoveryRegistry == null ? new RecoveryRegistry() : recoveryRegistry;
        this.notifier = notifier == null ? AttemptNotifier.NOOP : notifier;
        this.globalListeners = globalListeners == null ? List.of() : List.copyOf(globalListeners);
        this.sleeper = sleeper == null ? Sleeper.THREAD : sleeper;
    }

    @Override
    public <T> T execute(RetryDefinition definition, RetryCallback<T> callback) throws Exception {
        return doExecute(definition, callback, null);
    }

    @Override
    public <T> T execute(RetryDefinition definition, OperationSignature signature, RetryCallback<T> callback,
                         List<RecoveryDescriptor> recoveries, Object... args) throws Exception {
        Objects.requireNonNull(signature, "signature");
        Object[] actual = args == null ? new Object[0] : args;
        // 实参个数必须与签名一致, 恢复处理器按签名取参数前缀
        if (actual.length != signature.getParameterTypes().size()) {
            throw new IllegalArgumentException("signature declares " + signature.getParameterTypes().size()
                    + " parameters but " + actual.length + " arguments were given");
        }
        RecoveryCallback<T> recovery = recoveryResolver.resolve(definition.getLabel(), signature, recoveries)
                .map(d -> (RecoveryCallback<T>) new DescriptorRecoveryCallback<T>(d, signature.getResultType(), actual))
                .orElse(null);
        return doExecute(definition, callback, recovery);
    }

    @Override
    public <T> T execute(RetryDefinition definition, OperationSignature signature, RetryCallback<T> callback,
                         String recoveryScope, Object... args) throws Exception {
        return execute(definition, signature, callback, recoveryRegistry.get(recoveryScope), args);
    }

    @Override
    public RetryStatistics getStatistics() {
        return statistics;
    }

    public RecoveryRegistry getRecoveryRegistry() {
        return recoveryRegistry;
    }

    private <T> T doExecute(RetryDefinition definition, RetryCallback<T> callback,
                            RecoveryCallback<T> recovery) throws Exception {
        Objects.requireNonNull(definition, "definition");
        RetryContext context = RetryContext.named(definition.getLabel());

        List<RetryListener> listeners = new ArrayList<>(globalListeners);
        listeners.addAll(definition.getListeners());

        DefaultRetryExecutor executor = DefaultRetryExecutor.builder()
                .retryPolicy(SimpleRetryPolicy.from(definition))
                .backoffPolicy(backoffRegistry.create(definition))
                .listeners(listeners)
                .statistics(statistics)
                .sleeper(sleeper)
                .build();

        log.trace("[Retry-Template] executing name={}, maxAttempts={}, backoff={}, recovery={}",
                context.getName(), definition.getMaxAttempts(), definition.getBackoffStrategy(), recovery != null);
        try {
            return executor.execute(notifying(callback), recovery, context);
        } catch (RetryExhaustedException e) {
            log.error("[Retry-Template] retries exhausted name={}, attempts={}", context.getName(),
                    e.getAttempts(), e.getLastFailure());
            throw e;
        }
    }

    /**
     * 每次调用操作前通知一次, 通知失败不影响尝试
     */
    private <T> RetryCallback<T> notifying(RetryCallback<T> callback) {
        return ctx -> {
            try {
                notifier.beforeAttempt(AttemptEvent.builder()
                        .name(ctx.getName())
                        .attempt(ctx.getAttemptCount() + 1)
                        .lastFailure(ctx.getLastFailure())
                        .timestamp(Instant.now())
                        .build());
            } catch (RuntimeException e) {
                log.warn("[Retry-Template] notifier {} failed name={}", notifier.name(), ctx.getName(), e);
            }
            return callback.doWithRetry(ctx);
        };
    }
}
