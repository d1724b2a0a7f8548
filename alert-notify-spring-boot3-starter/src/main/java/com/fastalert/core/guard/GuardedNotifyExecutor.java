package com.fastalert.core.guard;

import com.fastalert.config.NotifyGuardProperties;
import com.fastalert.exception.NotifyException;
import com.fastalert.exception.guard.DownstreamBulkheadFullException;
import com.fastalert.exception.guard.DownstreamOpenCircuitException;
import com.fastalert.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;

import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按接收器类型对通知调用做 RateLimiter → Bulkhead → CircuitBreaker 装饰
 */
public class GuardedNotifyExecutor {

    private final NotifyGuardProperties props;

    private final ConcurrentHashMap<String, CircuitBreaker> cbCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Bulkhead>      bhCache = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, RateLimiter>   rlCache = new ConcurrentHashMap<>();

    public GuardedNotifyExecutor(NotifyGuardProperties props) {
        this.props = props;
    }

    /**
     * 不做任何装饰的执行器
     */
    public static GuardedNotifyExecutor disabled() {
        return new GuardedNotifyExecutor(new NotifyGuardProperties());
    }

    @FunctionalInterface
    public interface NotifyCall {
        void run() throws NotifyException;
    }

    /**
     * 统一入口
     * 只有可重试的失败计入熔断统计
     */
    public void execute(String type, NotifyCall call) throws Exception {
        Callable<Void> decorated = () -> {
            call.run();
            return null;
        };
        if (!props.isEnabled()) {
            decorated.call();
            return;
        }

        // RateLimit最外层限流，抑制突发流量
        if (enabled(props.getRateLimiter(), props.getRlPerType(), type)) {
            RateLimiter rl = rlCache.computeIfAbsent(type, this::buildRl);
            decorated = RateLimiter.decorateCallable(rl, decorated);
        }

        // Bulkhead 限制下游并发
        if (enabled(props.getBulkhead(), props.getBhPerType(), type)) {
            Bulkhead bh = bhCache.computeIfAbsent(type, this::buildBh);
            decorated = Bulkhead.decorateCallable(bh, decorated);
        }

        // CircuitBreaker fail-fast 熔断器
        if (enabled(props.getCircuitBreaker(), props.getCbPerType(), type)) {
            CircuitBreaker cb = cbCache.computeIfAbsent(type, this::buildCb);
            decorated = CircuitBreaker.decorateCallable(cb, decorated);
        }

        try {
            decorated.call();
        } catch (CallNotPermittedException open) {
            throw new DownstreamOpenCircuitException(type, open);
        } catch (BulkheadFullException full) {
            throw new DownstreamBulkheadFullException(type, full);
        } catch (RequestNotPermitted rnp) {
            throw new DownstreamRateLimitedException(type, rnp);
        }
    }

    private RateLimiter buildRl(String type) {
        NotifyGuardProperties.RlConfig r = pick(props.getRlPerType(), type, props.getRateLimiter());
        RateLimiterConfig cfg = RateLimiterConfig.custom()
                .limitForPeriod(r.getLimitForPeriod())
                .limitRefreshPeriod(r.getLimitRefreshPeriod())
                .timeoutDuration(r.getTimeoutDuration())
                .build();
        return RateLimiter.of("rl:" + type, cfg);
    }

    private Bulkhead buildBh(String type) {
        NotifyGuardProperties.BhConfig b = pick(props.getBhPerType(), type, props.getBulkhead());
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(b.getMaxConcurrentCalls())
                .maxWaitDuration(b.getMaxWaitDuration())
                .fairCallHandlingStrategyEnabled(true)
                .build();
        return Bulkhead.of("bh:" + type, cfg);
    }

    private CircuitBreaker buildCb(String type) {
        NotifyGuardProperties.CbConfig c = pick(props.getCbPerType(), type, props.getCircuitBreaker());
        CircuitBreakerConfig cfg = CircuitBreakerConfig.custom()
                .failureRateThreshold(c.getFailureRateThreshold())
                .slowCallRateThreshold(c.getSlowCallRateThreshold())
                .slowCallDurationThreshold(c.getSlowCallDurationThreshold())
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(c.getSlidingWindowSize())
                .minimumNumberOfCalls(c.getMinimumNumberOfCalls())
                .waitDurationInOpenState(c.getWaitDurationInOpenState())
                .permittedNumberOfCallsInHalfOpenState(c.getPermittedNumberOfCallsInHalfOpenState())
                // 供应商明确拒绝的请求不代表下游故障
                .recordException(t -> !(t instanceof NotifyException) || ((NotifyException) t).isRetryable())
                .build();
        return CircuitBreaker.of("cb:" + type, cfg);
    }

    private static <C> C pick(Map<String, C> perType, String type, C defaultCfg) {
        if (perType == null) {
            return defaultCfg;
        }
        C c = perType.get(type);
        return c == null ? defaultCfg : c;
    }

    private static <C extends NotifyGuardProperties.Toggle> boolean enabled(C defaultCfg, Map<String, C> map, String type) {
        if (defaultCfg == null) {
            return false;
        }
        C cfg = pick(map, type, defaultCfg);
        return cfg.isEnabled();
    }

    public CircuitBreaker getCircuitBreakerIfEnabled(String type) {
        if (!props.isEnabled() || !enabled(props.getCircuitBreaker(), props.getCbPerType(), type)) {
            return null;
        }
        return cbCache.computeIfAbsent(type, this::buildCb);
    }
}
