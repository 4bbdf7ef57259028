package com.retryloop.core.notify;

import com.retryloop.core.spi.notify.AttemptNotifier;
import com.retryloop.model.AttemptEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 依次派发到所有通知器, 单个通知器失败只记日志
 */
public class CompositeAttemptNotifier implements AttemptNotifier {

    private final Logger log = LoggerFactory.getLogger(CompositeAttemptNotifier.class);

    private final List<AttemptNotifier> notifiers;

    public CompositeAttemptNotifier(List<AttemptNotifier> notifiers) {
        this.notifiers = notifiers == null ? List.of() : List.copyOf(notifiers);
    }

    @Override
    public String name() {
        return "composite";
    }

    @Override
    public void beforeAttempt(AttemptEvent event) {
        for (AttemptNotifier n : notifiers) {
            try {
                n.beforeAttempt(event);
            } catch (RuntimeException e) {
                log.warn("[Notify] channel={} attempt={} failed", n.name(), event.getAttempt(), e);
            }
        }
    }
}
