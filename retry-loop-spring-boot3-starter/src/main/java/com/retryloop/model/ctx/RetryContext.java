package com.retryloop.model.ctx;

import java.util.HashMap;
import java.util.Map;

/**
 * 单次执行的重试上下文
 * - attemptCount 只在登记失败时 +1, 成功的调用不计数
 * - 每次执行独占一个实例, 非线程安全, 不可跨执行共享
 */
public class RetryContext {

    /** 名称（日志/指标标签），可为 null */
    private final String name;

    /** 已登记的失败次数 */
    private int attemptCount;

    /** 最近一次失败 */
    private Throwable lastFailure;

    /** 调用方自定义的关联数据 */
    private final Map<String, Object> attributes = new HashMap<>(8);

    public RetryContext() {
        this(null);
    }

    public RetryContext(String name) {
        this.name = name;
    }

    public static RetryContext named(String name) {
        return new RetryContext(name);
    }

    public int getAttemptCount() {
        return attemptCount;
    }

    public Throwable getLastFailure() {
        return lastFailure;
    }

    /**
     * 登记一次失败
     */
    public void registerFailure(Throwable failure) {
        this.attemptCount++;
        this.lastFailure = failure;
    }

    public Object getAttribute(String key) {
        return attributes.get(key);
    }

    public void setAttribute(String key, Object value) {
        attributes.put(key, value);
    }

    public boolean hasAttribute(String key) {
        return attributes.containsKey(key);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "RetryContext{name=" + name + ", attemptCount=" + attemptCount
                + ", lastFailure=" + (lastFailure == null ? null : lastFailure.toString()) + "}";
    }
}
