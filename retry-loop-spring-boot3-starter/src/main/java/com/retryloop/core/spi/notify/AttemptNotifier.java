package com.retryloop.core.spi.notify;

import com.retryloop.model.AttemptEvent;

/**
 * 尝试通知（每次调用操作之前派发一次）
 */
public interface AttemptNotifier {

    AttemptNotifier NOOP = new AttemptNotifier() {
        @Override
        public String name() {
            return "noop";
        }

        @Override
        public void beforeAttempt(AttemptEvent event) {
        }
    };

    /**
     * 返回此Notifier的渠道名称, 用于日志
     */
    String name();

    /**
     * 同步派发, 不应抛出异常
     */
    void beforeAttempt(AttemptEvent event);
}
