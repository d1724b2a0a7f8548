package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;
import com.fastalert.exception.NotifyException;

/**
 * Notifier 已显式给出是否可重试
 */
public class NotifyExceptionHandler implements FailureCaseHandler<NotifyException> {
    @Override
    public Class<NotifyException> exceptionType() {
        return NotifyException.class;
    }

    @Override
    public FailureDecider.Decision execute(NotifyException ex, ReceiverInfo receiver) {
        if (ex.isRetryable()) {
            return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.DELIVERY)
                    .withCode("DELIVERY").withMsg(ex.getMessage());
        }
        return FailureDecider.Decision.of(FailureDecider.Outcome.FAILED, FailureDecider.Category.VENDOR_REJECTED)
                .withCode("REJECTED").withMsg(ex.getMessage());
    }
}
