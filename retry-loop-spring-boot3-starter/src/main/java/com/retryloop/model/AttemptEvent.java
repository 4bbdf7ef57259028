package com.retryloop.model;

import lombok.Builder;
import lombok.Getter;

import java.time.Instant;

/**
 * 即将发起一次尝试
 */
@Getter
@Builder
public class AttemptEvent {

    private final String name;

    /** 第几次尝试, 从 1 开始 */
    private final int attempt;

    private final Throwable lastFailure;

    private final Instant timestamp;
}
