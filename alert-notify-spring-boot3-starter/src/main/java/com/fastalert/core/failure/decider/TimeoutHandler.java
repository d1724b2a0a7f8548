package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;

import java.util.concurrent.TimeoutException;

/**
 * 超时处理
 */
public class TimeoutHandler implements FailureCaseHandler<TimeoutException> {
    @Override
    public Class<TimeoutException> exceptionType() {
        return TimeoutException.class;
    }

    @Override
    public FailureDecider.Decision execute(TimeoutException ex, ReceiverInfo receiver) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TIMEOUT)
                .withCode("TIMEOUT");
    }
}
