package com.retryloop.core.listener;

import com.retryloop.core.spi.RetryListener;
import com.retryloop.model.ctx.RetryContext;
import lombok.extern.slf4j.Slf4j;

/**
 * 日志监听, 默认启用
 */
@Slf4j
public class LoggingRetryListener implements RetryListener {

    @Override
    public void onOpen(RetryContext context) {
        log.debug("[Retry-Listener] open name={}", context.getName());
    }

    @Override
    public void onRetry(RetryContext context) {
        log.debug("[Retry-Listener] retry name={}, attempt={}", context.getName(), context.getAttemptCount() + 1);
    }

    @Override
    public void onError(RetryContext context, Throwable failure) {
        log.info("[Retry-Listener] attempt failed name={}, attempt={}, err={}",
                context.getName(), context.getAttemptCount(), truncate(String.valueOf(failure)));
    }

    @Override
    public void onClose(RetryContext context, Throwable lastFailure) {
        if (lastFailure == null) {
            log.debug("[Retry-Listener] close name={}, failures={}", context.getName(), context.getAttemptCount());
        } else {
            log.warn("[Retry-Listener] close name={}, failures={}, lastErr={}",
                    context.getName(), context.getAttemptCount(), truncate(lastFailure.toString()));
        }
    }

    private String truncate(String s) {
        return s.length() > 2000 ? s.substring(0, 2000) : s;
    }
}
