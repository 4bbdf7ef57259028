package com.retryloop.core.backoff;

import com.retryloop.core.spi.BackoffPolicy;
import com.retryloop.core.spi.BackoffPolicyProvider;
import com.retryloop.model.RetryDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 策略注册中心：
 * - 内置 fixed / exponential
 * - 解析 "spi:{name}" 映射到外部注册的 BackoffPolicyProvider（name() 返回的名字）
 * - 线程安全
 */
public class BackoffRegistry {

    private static final Logger log = LoggerFactory.getLogger(BackoffRegistry.class);

    public static final String FIXED = "fixed";

    public static final String EXPONENTIAL = "exponential";

    private static final String PREFIX_SPI = "spi:";

    private final Map<String, BackoffPolicyProvider> providers = new ConcurrentHashMap<>(16);

    public BackoffRegistry(@Nullable List<BackoffPolicyProvider> discovered) {
        if (discovered != null) {
            discovered.forEach(p -> registry(p.name(), p));
        }
        // 内置策略
        providers.putIfAbsent(FIXED, new FixedProvider());
        providers.putIfAbsent(EXPONENTIAL, new ExponentialProvider());
    }

    public BackoffRegistry() {
        this(null);
    }

    /**
     * 注册或覆盖策略
     */
    public BackoffRegistry registry(String name, BackoffPolicyProvider provider) {
        providers.put(normalize(name), provider);
        return this;
    }

    /**
     * 按名称解析策略
     * 支持 spi:{name} 前缀, 未知名称回落到 exponential
     */
    public BackoffPolicyProvider resolve(@Nullable String strategy) {
        // 策略为空, 采用默认exponential策略
        if (strategy == null || strategy.isBlank()) {
            return providers.get(EXPONENTIAL);
        }
        String s = strategy.trim();
        String key = s.regionMatches(true, 0, PREFIX_SPI, 0, PREFIX_SPI.length())
                ? normalize(s.substring(PREFIX_SPI.length()))
                : normalize(s);
        BackoffPolicyProvider p = providers.get(key);
        if (p == null) {
            log.warn("[Backoff] unknown strategy '{}', falling back to {}", strategy, EXPONENTIAL);
            return providers.get(EXPONENTIAL);
        }
        return p;
    }

    /**
     * 根据定义创建本次执行使用的退避策略
     */
    public BackoffPolicy create(RetryDefinition definition) {
        return resolve(definition.getBackoffStrategy()).create(definition.getBackoff());
    }

    /** 列出已注册策略 */
    public Set<String> names() { return Collections.unmodifiableSet(providers.keySet()); }

    private static String normalize(String n) { return n.toLowerCase(Locale.ROOT).trim(); }

    private static final class FixedProvider implements BackoffPolicyProvider {
        @Override
        public String name() {
            return FIXED;
        }

        @Override
        public BackoffPolicy create(RetryDefinition.Backoff backoff) {
            return new FixedBackoffPolicy(backoff.getInitialDelay());
        }
    }

    private static final class ExponentialProvider implements BackoffPolicyProvider {
        @Override
        public String name() {
            return EXPONENTIAL;
        }

        @Override
        public BackoffPolicy create(RetryDefinition.Backoff backoff) {
            return ExponentialBackoffPolicy.from(backoff);
        }
    }
}
