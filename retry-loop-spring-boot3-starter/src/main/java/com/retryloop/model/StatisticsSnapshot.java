package com.retryloop.model;

import lombok.Value;

/**
 * 统计计数快照
 */
@Value
public class StatisticsSnapshot {
    long started;
    long success;
    long exhausted;
    long recovered;
}
