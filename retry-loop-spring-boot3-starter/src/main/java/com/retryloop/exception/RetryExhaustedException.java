package com.retryloop.exception;

import com.retryloop.model.ctx.RetryContext;
import lombok.Getter;

/**
 * 重试耗尽且无可用恢复处理器
 */
@Getter
public class RetryExhaustedException extends RuntimeException {

    private final transient RetryContext context;

    private final int attempts;

    /** 操作名称/标签, 可为 null */
    private final String operationName;

    public RetryExhaustedException(RetryContext context) {
        super("Retry attempts exhausted after " + context.getAttemptCount() + " attempts"
                + (context.getName() == null ? "" : " [" + context.getName() + "]"), context.getLastFailure());
        this.context = context;
        this.attempts = context.getAttemptCount();
        this.operationName = context.getName();
    }

    public Throwable getLastFailure() {
        return getCause();
    }
}
