package com.retryloop.config;

import com.retryloop.model.RetryDefinition;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 重试默认配置（绑定前缀：retry）
 *
 * YAML 示例：
 * retry:
 *   default-max-attempts: 3
 *   backoff:
 *     strategy: exponential
 *     delay: 1s
 *     multiplier: 2.0
 *     max-delay: 30s
 *     jitter: false
 *   metrics:
 *     enabled: true
 *     tags:
 *       region: cn-east
 *   notify:
 *     events: false
 */
@Data
@ConfigurationProperties(prefix = "retry")
public class RetryLoopProperties {

    /** 默认最大尝试次数（含首次） */
    private int defaultMaxAttempts = 3;

    private Backoff backoff = new Backoff();

    private Metrics metrics = new Metrics();

    private Notify notify = new Notify();

    /**
     * 以默认配置生成定义, 调用方可再通过 toBuilder() 覆盖
     */
    public RetryDefinition toDefinition(String label) {
        return RetryDefinition.builder()
                .maxAttempts(defaultMaxAttempts)
                .backoffStrategy(backoff.getStrategy())
                .backoff(RetryDefinition.Backoff.builder()
                        .initialDelay(backoff.getDelay())
                        .multiplier(backoff.getMultiplier())
                        .maxDelay(backoff.getMaxDelay())
                        .jitter(backoff.isJitter())
                        .build())
                .label(label)
                .build();
    }

    @Data
    public static class Backoff {
        /** fixed | exponential | spi:{name} */
        private String strategy = "exponential";

        /** 初始延迟, fixed 策略下即固定延迟 */
        private Duration delay = Duration.ofSeconds(1);

        private double multiplier = 2.0;

        private Duration maxDelay = Duration.ofSeconds(30);

        /** ±25% 抖动 */
        private boolean jitter = false;
    }

    @Data
    public static class Metrics {
        private boolean enabled = true;

        /** retry.* 指标的公共标签, 未配置 application 时取 spring.application.name */
        private Map<String, String> tags = new LinkedHashMap<>();
    }

    @Data
    public static class Notify {
        /** 是否以 Spring 事件发布每次尝试 */
        private boolean events = false;
    }
}
