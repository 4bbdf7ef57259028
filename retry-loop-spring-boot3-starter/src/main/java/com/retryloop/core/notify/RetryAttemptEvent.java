package com.retryloop.core.notify;

import com.retryloop.model.AttemptEvent;
import org.springframework.context.ApplicationEvent;

import java.time.Clock;

/**
 * 尝试即将发生的 Spring 事件
 */
public class RetryAttemptEvent extends ApplicationEvent {

    public RetryAttemptEvent(AttemptEvent source, Clock clock) {
        super(source, clock);
    }

    public AttemptEvent getAttempt() {
        return (AttemptEvent) getSource();
    }
}
