package com.retryloop.autoconfig;

import com.retryloop.config.RetryLoopProperties;
import com.retryloop.core.listener.MetricsRetryListener;
import com.retryloop.core.metric.MicrometerRetryStatistics;
import com.retryloop.core.metric.RetryMeterRegistryProvider;
import com.retryloop.core.metric.RetryMetrics;
import com.retryloop.core.spi.RetryStatistics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@AutoConfiguration
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnProperty(prefix = "retry.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(RetryLoopProperties.class)
public class RetryLoopMetricsAutoConfiguration {

    @Bean
    public RetryMeterRegistryProvider retryMeterRegistryProvider(ObjectProvider<MeterRegistry> discovered,
                                                                 RetryLoopProperties properties,
                                                                 Environment environment) {
        Map<String, String> tags = new LinkedHashMap<>(properties.getMetrics().getTags());
        String application = environment.getProperty("spring.application.name");
        if (application != null) {
            tags.putIfAbsent("application", application);
        }
        return new RetryMeterRegistryProvider(discovered.orderedStream().collect(Collectors.toList()), tags);
    }

    @Bean
    public RetryMetrics retryMetrics(RetryMeterRegistryProvider provider) {
        return RetryMetrics.create(provider.getRegistry());
    }

    @Bean
    @ConditionalOnMissingBean(RetryStatistics.class)
    public RetryStatistics micrometerRetryStatistics(RetryMetrics metrics) {
        return new MicrometerRetryStatistics(metrics);
    }

    @Bean
    public MetricsRetryListener metricsRetryListener(RetryMetrics metrics) {
        return new MetricsRetryListener(metrics);
    }
}
