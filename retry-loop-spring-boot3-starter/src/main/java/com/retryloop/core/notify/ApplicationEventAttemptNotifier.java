package com.retryloop.core.notify;

import com.retryloop.core.spi.notify.AttemptNotifier;
import com.retryloop.model.AttemptEvent;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;

/**
 * 通过注入的 ApplicationEventPublisher 发布 RetryAttemptEvent
 */
public class ApplicationEventAttemptNotifier implements AttemptNotifier {

    private final ApplicationEventPublisher publisher;

    private final Clock clock;

    public ApplicationEventAttemptNotifier(ApplicationEventPublisher publisher) {
        this(publisher, Clock.systemUTC());
    }

    public ApplicationEventAttemptNotifier(ApplicationEventPublisher publisher, Clock clock) {
        this.publisher = publisher;
        this.clock = clock;
    }

    @Override
    public String name() {
        return "event";
    }

    @Override
    public void beforeAttempt(AttemptEvent event) {
        publisher.publishEvent(new RetryAttemptEvent(event, clock));
    }
}
