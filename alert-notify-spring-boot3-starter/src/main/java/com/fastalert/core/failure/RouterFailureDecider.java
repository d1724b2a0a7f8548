package com.fastalert.core.failure;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class RouterFailureDecider implements FailureDecider {

    private final List<FailureCaseHandler<?>> handlers;

    /** 兜底处理器 (处理 Throwable), 只在整条 cause 链都未命中时使用 */
    private final List<FailureCaseHandler<?>> fallbacks;

    /** 未匹配时的默认决策 */
    private final Decision defaultDecision;

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers) {
        this(handlers, Decision.of(Outcome.FAILED, Category.UNKNOWN).withCode("UNHANDLED"));
    }

    public RouterFailureDecider(List<FailureCaseHandler<?>> handlers, Decision defaultDecision) {
        List<FailureCaseHandler<?>> distinct = handlers.stream().distinct().collect(Collectors.toList());
        this.handlers = distinct.stream().filter(h -> h.exceptionType() != Throwable.class).collect(Collectors.toList());
        this.fallbacks = distinct.stream().filter(h -> h.exceptionType() == Throwable.class).collect(Collectors.toList());
        this.defaultDecision = defaultDecision;
    }

    /**
     * 同类型匹配时选择离异常类最近的处理器
     */
    @Override
    public Decision decide(Throwable t, ReceiverInfo receiver) {
        // 展开 cause 链 先本体, 再逐级cause
        for (Throwable e = t; e != null; e = e.getCause()) {
            FailureCaseHandler<?> matched = findBestHandler(handlers, e);
            if (matched != null) {
                return safeCall(matched, e, receiver);
            }
            if (e.getCause() == e) {
                break;
            }
        }
        FailureCaseHandler<?> fallback = t == null ? null : findBestHandler(fallbacks, t);
        return fallback == null ? defaultDecision : safeCall(fallback, t, receiver);
    }

    @SuppressWarnings({"unchecked","rawtypes"})
    private Decision safeCall(FailureCaseHandler h, Throwable e, ReceiverInfo receiver) {
        return h.execute(e, receiver);
    }

    private static FailureCaseHandler<?> findBestHandler(List<FailureCaseHandler<?>> candidates, Throwable e) {
        // 过滤 supports 再按继承层级深度排序
        return candidates.stream()
                .filter(h -> h.supports(e))
                .min(Comparator.comparingInt(h -> distance(e.getClass(), h.exceptionType())))
                .orElse(null);
    }

    private static int distance(Class<?> from, Class<?> to) {
        // 计算from向上继承到to的距离
        int d = 0;
        Class<?> c = from;
        while (c != null && !to.equals(c)) {
            c = c.getSuperclass();
            ++ d;
        }
        return (c == null) ? Integer.MAX_VALUE : d;
    }
}
