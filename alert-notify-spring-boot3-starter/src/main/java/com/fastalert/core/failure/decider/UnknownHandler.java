package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;


/**
 * 未知异常, 不重试
 */
public class UnknownHandler implements FailureCaseHandler<Throwable> {
    @Override
    public Class<Throwable> exceptionType() {
        return Throwable.class;
    }

    @Override
    public FailureDecider.Decision execute(Throwable ex, ReceiverInfo receiver) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.FAILED, FailureDecider.Category.UNKNOWN)
                .withCode("UNHANDLED");
    }
}
