package com.retryloop.core.metric;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * retry.* 指标写入的注册表
 * - 外部注册表（含组合注册表的成员）全部合入
 * - 没有外部注册表时用本地 Simple 计数
 * - 公共标签作用于全部 retry.* 指标
 */
public class RetryMeterRegistryProvider {

    private final CompositeMeterRegistry composite = new CompositeMeterRegistry();

    private final Tags commonTags;

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered, Map<String, String> commonTags) {
        List<MeterRegistry> targets = flatten(discovered);
        if (targets.isEmpty()) {
            composite.add(new SimpleMeterRegistry());
        } else {
            targets.forEach(composite::add);
        }

        Tags tags = Tags.empty();
        if (commonTags != null) {
            for (Map.Entry<String, String> e : commonTags.entrySet()) {
                if (e.getValue() != null && !e.getValue().isBlank()) {
                    tags = tags.and(e.getKey(), e.getValue());
                }
            }
        }
        this.commonTags = tags;
        composite.config().commonTags(tags);
    }

    public RetryMeterRegistryProvider(List<MeterRegistry> discovered) {
        this(discovered, Map.of());
    }

    private static List<MeterRegistry> flatten(List<MeterRegistry> discovered) {
        List<MeterRegistry> out = new ArrayList<>();
        if (discovered == null) {
            return out;
        }
        for (MeterRegistry mr : discovered) {
            if (mr instanceof CompositeMeterRegistry c) {
                out.addAll(c.getRegistries());
            } else {
                out.add(mr);
            }
        }
        return out;
    }

    public MeterRegistry getRegistry() { return composite; }

    public Tags getCommonTags() { return commonTags; }
}
