package com.retryloop.core.spi;

import com.retryloop.model.RetryDefinition;

/**
 * 按名称注册的退避策略工厂, 每次执行根据定义创建新的策略实例
 */
public interface BackoffPolicyProvider {

    /** 策略唯一名称（如 "fixed"、"exponential"、"myPolicy"） */
    String name();

    BackoffPolicy create(RetryDefinition.Backoff backoff);
}
