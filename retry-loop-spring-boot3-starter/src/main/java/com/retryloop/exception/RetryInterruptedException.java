package com.retryloop.exception;

import com.retryloop.model.ctx.RetryContext;
import lombok.Getter;

/**
 * 退避等待期间线程被中断, 执行被取消
 */
@Getter
public class RetryInterruptedException extends RuntimeException {

    private final transient RetryContext context;

    public RetryInterruptedException(RetryContext context, InterruptedException cause) {
        super("Retry interrupted after " + context.getAttemptCount() + " attempts"
                + (context.getName() == null ? "" : " [" + context.getName() + "]"), cause);
        this.context = context;
    }
}
