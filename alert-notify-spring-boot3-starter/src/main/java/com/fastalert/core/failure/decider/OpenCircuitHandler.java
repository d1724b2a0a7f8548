package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;
import com.fastalert.exception.guard.DownstreamOpenCircuitException;

/**
 * 熔断打开
 */
public class OpenCircuitHandler implements FailureCaseHandler<DownstreamOpenCircuitException> {
    @Override
    public Class<DownstreamOpenCircuitException> exceptionType() {
        return DownstreamOpenCircuitException.class;
    }

    @Override
    public FailureDecider.Decision execute(DownstreamOpenCircuitException ex, ReceiverInfo receiver) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.OPEN_CIRCUIT)
                .withCode("CB_OPEN");
    }
}
