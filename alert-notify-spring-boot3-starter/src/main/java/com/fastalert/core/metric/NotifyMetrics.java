package com.fastalert.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

/**
 * 通知指标, 按接收器类型打 integration 标签
 */
public final class NotifyMetrics {

    private final MeterRegistry reg;

    private NotifyMetrics(MeterRegistry reg) {
        this.reg = reg;
    }

    public static NotifyMetrics create(MeterRegistry reg) { return new NotifyMetrics(reg); }

    public static NotifyMetrics noop() { return new NotifyMetrics(new SimpleMeterRegistry()); }

    public void incSent(String integration) {
        Counter.builder("alert.notify.sent").description("notifications delivered")
                .tag("integration", integration).register(reg).increment();
    }

    public void incFailed(String integration, boolean retryable) {
        Counter.builder("alert.notify.failed").description("notifications failed")
                .tag("integration", integration).tag("retryable", String.valueOf(retryable))
                .register(reg).increment();
    }

    public void incSuppressed(String integration) {
        Counter.builder("alert.notify.suppressed").description("resolved notifications suppressed")
                .tag("integration", integration).register(reg).increment();
    }

    public void recordNanos(String integration, long nanos) {
        Timer.builder("alert.notify.time").description("notify call time")
                .tag("integration", integration).register(reg).record(nanos, TimeUnit.NANOSECONDS);
    }

    public MeterRegistry registry() {
        return reg;
    }
}
