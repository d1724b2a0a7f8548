package com.fastalert.core.notify;

import com.fastalert.core.guard.GuardedNotifyExecutor;
import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.notify.NotifierFactory;
import com.fastalert.exception.ReceiverConfigException;
import com.fastalert.exception.ReceiverInitException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * 按名称持有已初始化的接收器
 * 配置错误在注册时即抛出 ReceiverInitException, 不会延迟到首次通知
 */
@Slf4j
public class ReceiverRegistry {

    private final Map<String, NotifierFactory> factories = new LinkedHashMap<>();

    private final Map<String, Integration> integrations = new LinkedHashMap<>();

    private final NotifierDependencies deps;

    private final FailureDecider decider;

    private final GuardedNotifyExecutor guard;

    private final NotifyMetrics metrics;

    private final Clock clock;

    public ReceiverRegistry(List<NotifierFactory> factories, NotifierDependencies deps, FailureDecider decider,
                            GuardedNotifyExecutor guard, NotifyMetrics metrics) {
        for (NotifierFactory f : factories) {
            // 后注册的同名类型覆盖内置实现
            this.factories.put(f.type(), f);
        }
        this.deps = deps;
        this.decider = decider;
        this.guard = guard;
        this.metrics = metrics;
        this.clock = deps.getClock();
    }

    public synchronized Integration register(ReceiverMetadata meta, JsonNode settings, DecryptFunction decrypt) {
        NotifierFactory factory = factories.get(meta.getType());
        if (factory == null) {
            throw new ReceiverInitException(meta.getName(), meta.getType(), "notifier type not supported", null);
        }
        if (integrations.containsKey(meta.getName())) {
            throw new ReceiverInitException(meta.getName(), meta.getType(), "receiver name is already in use", null);
        }
        Notifier notifier;
        try {
            notifier = factory.create(meta, Settings.of(settings), decrypt, deps);
        } catch (ReceiverConfigException e) {
            throw new ReceiverInitException(meta.getName(), meta.getType(), e.getMessage(), e);
        }
        Integration integration = new Integration(notifier, decider, guard, metrics, clock);
        integrations.put(meta.getName(), integration);
        log.info("[Receiver] registered receiver={} type={} sendResolved={}", meta.getName(), meta.getType(), integration.sendResolved());
        return integration;
    }

    public synchronized Optional<Integration> get(String name) {
        return Optional.ofNullable(integrations.get(name));
    }

    public synchronized List<Integration> all() {
        return Collections.unmodifiableList(new ArrayList<>(integrations.values()));
    }

    public Set<String> supportedTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(factories.keySet()));
    }
}
