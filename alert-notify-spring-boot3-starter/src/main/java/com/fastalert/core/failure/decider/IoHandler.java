package com.fastalert.core.failure.decider;

import com.fastalert.core.spi.failure.FailureCaseHandler;
import com.fastalert.core.spi.failure.FailureDecider;
import com.fastalert.core.spi.notify.ReceiverInfo;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * 网络层失败 (连接拒绝 / 读写超时), 可重试
 */
public class IoHandler implements FailureCaseHandler<IOException> {
    @Override
    public Class<IOException> exceptionType() {
        return IOException.class;
    }

    @Override
    public FailureDecider.Decision execute(IOException ex, ReceiverInfo receiver) {
        if (ex instanceof InterruptedIOException) {
            return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.TIMEOUT)
                    .withCode("IO_TIMEOUT").withMsg(ex.getMessage());
        }
        return FailureDecider.Decision.of(FailureDecider.Outcome.RETRY, FailureDecider.Category.IO)
                .withCode("IO").withMsg(ex.getMessage());
    }
}
