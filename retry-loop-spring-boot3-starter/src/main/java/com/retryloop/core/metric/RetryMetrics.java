package com.retryloop.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

public final class RetryMetrics {
    private final Counter started;
    private final Counter success;
    private final Counter exhausted;
    private final Counter recovered;
    private final Counter error;
    private final DistributionSummary attempts;
    private final Timer execTimer;

    private RetryMetrics(MeterRegistry reg) {
        this.started   = Counter.builder("retry.started").description("executions started").register(reg);
        this.success   = Counter.builder("retry.success").description("executions succeeded").register(reg);
        this.exhausted = Counter.builder("retry.exhausted").description("executions exhausted").register(reg);
        this.recovered = Counter.builder("retry.recovered").description("executions recovered").register(reg);
        this.error     = Counter.builder("retry.error").description("failed attempts").register(reg);
        this.attempts  = DistributionSummary.builder("retry.attempts")
                .description("failed attempt count per execution").baseUnit("times").register(reg);
        this.execTimer = Timer.builder("retry.exec.time").description("execution time including backoff").register(reg);
    }

    public static RetryMetrics create(MeterRegistry reg) { return new RetryMetrics(reg); }

    public void incStarted(){   started.increment(); }
    public void incSuccess(){   success.increment(); }
    public void incExhausted(){ exhausted.increment(); }
    public void incRecovered(){ recovered.increment(); }
    public void incError(){     error.increment(); }
    public void recordAttempts(int n){ attempts.record(n); }
    public void recordExecNanos(long nanos){ execTimer.record(nanos, TimeUnit.NANOSECONDS); }
}
