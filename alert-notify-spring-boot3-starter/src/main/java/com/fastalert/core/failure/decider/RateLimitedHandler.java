package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;
import com.fastalert.exception.guard.DownstreamRateLimitedException;

/**
 * 限流拒绝
 */
public class RateLimitedHandler implements FailureCaseHandler<DownstreamRateLimitedException> {
    @Override
    public Class<DownstreamRateLimitedException> exceptionType() {
        return DownstreamRateLimitedException.class;
    }

    @Override
    public FailureDecider.Decision execute(DownstreamRateLimitedException ex, ReceiverInfo receiver) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.RATE_LIMITED)
                .withCode("RATE_LIMIT");
    }
}
