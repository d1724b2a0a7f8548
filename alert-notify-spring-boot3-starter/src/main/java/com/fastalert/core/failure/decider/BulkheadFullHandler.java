package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;
import com.fastalert.exception.guard.DownstreamBulkheadFullException;

/**
 * 并发已满
 */
public class BulkheadFullHandler implements FailureCaseHandler<DownstreamBulkheadFullException> {
    @Override
    public Class<DownstreamBulkheadFullException> exceptionType() {
        return DownstreamBulkheadFullException.class;
    }

    @Override
    public FailureDecider.Decision execute(DownstreamBulkheadFullException ex, ReceiverInfo receiver) {
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.BULKHEAD_FULL)
                .withCode("BULKHEAD_FULL");
    }
}
