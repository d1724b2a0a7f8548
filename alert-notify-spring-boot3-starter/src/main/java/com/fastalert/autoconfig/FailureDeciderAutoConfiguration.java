package com.fastalert.autoconfig;

import com.fastalert.core.failure.RouterFailureDecider;
import com.fastalert.core.failure.decider.BulkheadFullHandler;
import com.fastalert.core.failure.decider.IoHandler;
import com.fastalert.core.failure.decider.NotifyExceptionHandler;
import com.fastalert.core.failure.decider.OpenCircuitHandler;
import com.fastalert.core.failure.decider.RateLimitedHandler;
import com.fastalert.core.failure.decider.TimeoutHandler;
import com.fastalert.core.failure.decider.UnknownHandler;
import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;

import java.util.List;

@AutoConfiguration
public class FailureDeciderAutoConfiguration {

    // 默认内置一组决策器（用户可通过 Bean 覆盖/新增）
    @Bean
    @ConditionalOnMissingBean(NotifyExceptionHandler.class)
    public NotifyExceptionHandler notifyExceptionHandler() { return new NotifyExceptionHandler(); }

    @Bean
    @ConditionalOnMissingBean(IoHandler.class)
    public IoHandler ioHandler() { return new IoHandler(); }

    @Bean
    @ConditionalOnMissingBean(OpenCircuitHandler.class)
    public OpenCircuitHandler openCircuitHandler() { return new OpenCircuitHandler(); }

    @Bean
    @ConditionalOnMissingBean(RateLimitedHandler.class)
    public RateLimitedHandler rateLimitedHandler() { return new RateLimitedHandler(); }

    @Bean
    @ConditionalOnMissingBean(BulkheadFullHandler.class)
    public BulkheadFullHandler bulkheadFullHandler() { return new BulkheadFullHandler(); }

    @Bean
    @ConditionalOnMissingBean(TimeoutHandler.class)
    public TimeoutHandler timeoutHandler() { return new TimeoutHandler(); }

    @Bean
    @ConditionalOnMissingBean(UnknownHandler.class)
    public UnknownHandler unknownHandler() { return new UnknownHandler(); }

    // Router 决策器, 把所有 FailureCaseHandler 注入
    @Bean
    @ConditionalOnMissingBean(FailureDecider.class)
    public FailureDecider failureDecider(List<FailureCaseHandler<?>> handlers) {
        return new RouterFailureDecider(handlers);
    }
}
