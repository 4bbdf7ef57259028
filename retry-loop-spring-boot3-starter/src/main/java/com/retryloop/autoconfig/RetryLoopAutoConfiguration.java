package com.retryloop.autoconfig;

import com.retryloop.config.RetryLoopProperties;
import com.retryloop.core.RetryOperations;
import com.retryloop.core.backoff.BackoffRegistry;
import com.retryloop.core.engine.RetryTemplate;
import com.retryloop.core.listener.LoggingRetryListener;
import com.retryloop.core.notify.ApplicationEventAttemptNotifier;
import com.retryloop.core.notify.CompositeAttemptNotifier;
import com.retryloop.core.notify.LoggingAttemptNotifier;
import com.retryloop.core.recovery.DefaultRecoveryResolver;
import com.retryloop.core.recovery.RecoveryRegistry;
import com.retryloop.core.spi.*;
import com.retryloop.core.spi.notify.AttemptNotifier;
import com.retryloop.core.statistics.InMemoryRetryStatistics;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 重试执行入口及其协作组件
 */
@AutoConfiguration(after = RetryLoopMetricsAutoConfiguration.class)
@EnableConfigurationProperties(RetryLoopProperties.class)
public class RetryLoopAutoConfiguration {

    /**
     * 策略注册中心, 合入容器中的自定义 BackoffPolicyProvider
     */
    @Bean
    @ConditionalOnMissingBean(BackoffRegistry.class)
    public BackoffRegistry backoffRegistry(ObjectProvider<BackoffPolicyProvider> discovered) {
        return new BackoffRegistry(discovered.orderedStream().collect(Collectors.toList()));
    }

    /**
     * 默认内存统计（启用指标时由 Micrometer 实现替代）
     */
    @Bean
    @ConditionalOnMissingBean(RetryStatistics.class)
    public RetryStatistics retryStatistics() {
        return new InMemoryRetryStatistics();
    }

    @Bean
    @ConditionalOnMissingBean(RecoveryResolver.class)
    public RecoveryResolver recoveryResolver() {
        return new DefaultRecoveryResolver();
    }

    @Bean
    @ConditionalOnMissingBean(RecoveryRegistry.class)
    public RecoveryRegistry recoveryRegistry() {
        return new RecoveryRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingRetryListener.class)
    public LoggingRetryListener loggingRetryListener() {
        return new LoggingRetryListener();
    }

    @Bean
    @ConditionalOnMissingBean(LoggingAttemptNotifier.class)
    public LoggingAttemptNotifier loggingAttemptNotifier() {
        return new LoggingAttemptNotifier();
    }

    @Bean
    @ConditionalOnProperty(prefix = "retry.notify", name = "events", havingValue = "true")
    public ApplicationEventAttemptNotifier applicationEventAttemptNotifier(ApplicationEventPublisher publisher) {
        return new ApplicationEventAttemptNotifier(publisher);
    }

    /**
     * 重试执行入口
     */
    @Bean
    @ConditionalOnMissingBean(RetryOperations.class)
    public RetryTemplate retryTemplate(BackoffRegistry backoffRegistry,
                                       RetryStatistics statistics,
                                       RecoveryResolver recoveryResolver,
                                       RecoveryRegistry recoveryRegistry,
                                       ObjectProvider<AttemptNotifier> notifiers,
                                       ObjectProvider<RetryListener> listeners) {
        List<AttemptNotifier> n = notifiers.orderedStream().collect(Collectors.toList());
        return new RetryTemplate(backoffRegistry, statistics, recoveryResolver, recoveryRegistry,
                new CompositeAttemptNotifier(n),
                listeners.orderedStream().collect(Collectors.toList()),
                Sleeper.THREAD);
    }
}
