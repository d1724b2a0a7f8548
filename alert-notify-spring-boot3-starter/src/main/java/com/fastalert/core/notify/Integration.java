package com.fastalert.core.notify;

import com.fastalert.core.guard.GuardedNotifyExecutor;
import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.notify.ReceiverInfo;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 接收器与外层管道之间的边界
 * 负责恢复通知抑制, 保护装饰, 失败判定与指标, 本身不做重试
 */
@Slf4j
public class Integration implements ReceiverInfo {

    private final Notifier notifier;

    private final FailureDecider decider;

    private final GuardedNotifyExecutor guard;

    private final NotifyMetrics metrics;

    private final Clock clock;

    public Integration(Notifier notifier, FailureDecider decider, GuardedNotifyExecutor guard,
                       NotifyMetrics metrics, Clock clock) {
        this.notifier = notifier;
        this.decider = decider;
        this.guard = guard;
        this.metrics = metrics;
        this.clock = clock;
    }

    public NotifyResult notify(NotifyContext ctx, List<Alert> alerts) {
        if (alerts == null || alerts.isEmpty()) {
            log.debug("[Notify-{}] receiver={} nothing to send", type(), name());
            return NotifyResult.success();
        }
        NotifyContext scoped = ctx.withReceiverName(name());
        Instant now = clock.instant();
        boolean resolved = alerts.stream().allMatch(a -> a.isResolved(now));
        if (resolved && !notifier.sendResolved()) {
            metrics.incSuppressed(type());
            log.debug("[Notify-{}] receiver={} group={} resolved message suppressed", type(), name(), ctx.getGroupKey());
            return NotifyResult.success();
        }

        long start = System.nanoTime();
        try {
            guard.execute(type(), () -> notifier.notify(scoped, alerts));
            metrics.incSent(type());
            log.debug("[Notify-{}] receiver={} group={} delivered, alerts={}", type(), name(), ctx.getGroupKey(), alerts.size());
            return NotifyResult.success();
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            FailureDecider.Decision d = decider.decide(e, notifier);
            metrics.incFailed(type(), d.isRetryable());
            log.warn("[Notify-{}] receiver={} group={} failed, retryable={}, category={}, code={}, err={}",
                    type(), name(), ctx.getGroupKey(), d.isRetryable(), d.getCategory(), d.getCode(), e.getMessage());
            return NotifyResult.failure(d.isRetryable(), e);
        } finally {
            metrics.recordNanos(type(), System.nanoTime() - start);
        }
    }

    public boolean sendResolved() {
        return notifier.sendResolved();
    }

    public Notifier getNotifier() {
        return notifier;
    }

    @Override
    public String name() {
        return notifier.name();
    }

    @Override
    public String type() {
        return notifier.type();
    }

    @Override
    public boolean disableResolve() {
        return notifier.disableResolve();
    }
}
