package com.retryloop.core.spi;

import java.time.Duration;

/**
 * 退避等待
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = d -> Thread.sleep(d.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
