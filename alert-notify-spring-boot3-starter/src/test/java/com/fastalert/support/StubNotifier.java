package com.fastalert.support;

import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 按预设行为执行的 Notifier, 记录每次调用的上下文
 */
public class StubNotifier implements Notifier {

    @FunctionalInterface
    public interface Behavior {
        void run(NotifyContext ctx, List<Alert> alerts) throws NotifyException;
    }

    private final ReceiverMetadata meta;

    private final Behavior behavior;

    private final List<NotifyContext> calls = new CopyOnWriteArrayList<>();

    public StubNotifier(ReceiverMetadata meta, Behavior behavior) {
        this.meta = meta;
        this.behavior = behavior;
    }

    public static StubNotifier ok(ReceiverMetadata meta) {
        return new StubNotifier(meta, (c, a) -> { });
    }

    public static StubNotifier failing(ReceiverMetadata meta, NotifyException e) {
        return new StubNotifier(meta, (c, a) -> {
            throw e;
        });
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        calls.add(ctx);
        behavior.run(ctx, alerts);
    }

    public List<NotifyContext> calls() {
        return calls;
    }

    @Override
    public String name() {
        return meta.name();
    }

    @Override
    public String type() {
        return meta.type();
    }

    @Override
    public boolean disableResolve() {
        return meta.disableResolve();
    }
}
