package com.fastalert.core.guard;

import com.fastalert.config.NotifyGuardProperties;
import com.fastalert.exception.NotifyException;
import com.fastalert.exception.guard.DownstreamOpenCircuitException;
import com.fastalert.exception.guard.DownstreamRateLimitedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GuardedNotifyExecutorTest {

    private static NotifyGuardProperties smallWindow() {
        NotifyGuardProperties props = new NotifyGuardProperties();
        props.setEnabled(true);
        props.getCircuitBreaker().setSlidingWindowSize(2);
        props.getCircuitBreaker().setMinimumNumberOfCalls(2);
        props.getCircuitBreaker().setWaitDurationInOpenState(Duration.ofMinutes(1));
        return props;
    }

    @Test
    void shouldRunCallDirectlyWhenDisabled() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        GuardedNotifyExecutor.disabled().execute("slack", calls::incrementAndGet);

        assertThat(calls).hasValue(1);
        assertThat(GuardedNotifyExecutor.disabled().getCircuitBreakerIfEnabled("slack")).isNull();
    }

    @Test
    void shouldOpenCircuitAfterRetryableFailures() throws Exception {
        GuardedNotifyExecutor guard = new GuardedNotifyExecutor(smallWindow());
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> guard.execute("slack", () -> {
                throw NotifyException.retryable("unexpected status code 503: ");
            })).isInstanceOf(NotifyException.class);
        }

        assertThat(guard.getCircuitBreakerIfEnabled("slack").getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThatThrownBy(() -> guard.execute("slack", () -> { }))
                .isInstanceOf(DownstreamOpenCircuitException.class)
                .hasMessage("downstream circuit open: slack");
        // 其他类型不受影响
        guard.execute("webhook", () -> { });
    }

    @Test
    void shouldNotCountVendorRejectionsAgainstCircuit() throws Exception {
        GuardedNotifyExecutor guard = new GuardedNotifyExecutor(smallWindow());
        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> guard.execute("jira", () -> {
                throw NotifyException.permanent("unexpected status code 400: ");
            })).isInstanceOf(NotifyException.class);
        }

        assertThat(guard.getCircuitBreakerIfEnabled("jira").getState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    void shouldRateLimitPerType() throws Exception {
        NotifyGuardProperties props = new NotifyGuardProperties();
        props.setEnabled(true);
        props.getCircuitBreaker().setEnabled(false);
        NotifyGuardProperties.RlConfig rl = new NotifyGuardProperties.RlConfig();
        rl.setEnabled(true);
        rl.setLimitForPeriod(1);
        rl.setLimitRefreshPeriod(Duration.ofMinutes(1));
        props.setRlPerType(Map.of("telegram", rl));
        GuardedNotifyExecutor guard = new GuardedNotifyExecutor(props);

        guard.execute("telegram", () -> { });

        assertThatThrownBy(() -> guard.execute("telegram", () -> { }))
                .isInstanceOf(DownstreamRateLimitedException.class);
    }
}
