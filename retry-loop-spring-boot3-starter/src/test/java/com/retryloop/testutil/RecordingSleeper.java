package com.retryloop.testutil;

import com.retryloop.core.spi.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 只记录等待时长, 不真正休眠
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = new ArrayList<>();

    @Override
    public void sleep(Duration duration) {
        sleeps.add(duration);
    }

    public List<Duration> sleeps() {
        return sleeps;
    }
}
