package com.retryloop.core.notify;

import com.retryloop.core.spi.notify.AttemptNotifier;
import com.retryloop.model.AttemptEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 日志通知, 默认启用
 */
public class LoggingAttemptNotifier implements AttemptNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingAttemptNotifier.class);

    @Override
    public String name() {
        return "log";
    }

    @Override
    public void beforeAttempt(AttemptEvent event) {
        if (event.getAttempt() == 1) {
            log.debug("[Notify-Attempt] name={}, attempt=1", event.getName());
        } else {
            log.debug("[Notify-Attempt] name={}, attempt={}, lastErr={}",
                    event.getName(), event.getAttempt(), event.getLastFailure());
        }
    }
}
