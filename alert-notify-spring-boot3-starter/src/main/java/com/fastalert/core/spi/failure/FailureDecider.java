package com.fastalert.core.spi.failure;

import com.fastalert.core.spi.notify.ReceiverInfo;
import lombok.Getter;

/**
 * 失败判定器 按异常类型给出是否可重试
 */
public interface FailureDecider {

    /**
     * 根据异常做出决策
     */
    Decision decide(Throwable t, ReceiverInfo receiver);

    @Getter
    final class Decision {
        private final Outcome outcome;
        private final Category category;
        private final String code;
        private final String message;

        private Decision(Outcome o, Category c, String code, String msg) {
            this.outcome = o; this.category = c; this.code = code; this.message = msg;
        }
        public static Decision of(Outcome o, Category c) { return new Decision(o, c, null, null); }
        public Decision withCode(String code){ return new Decision(outcome, category, code, message); }
        public Decision withMsg(String msg){ return new Decision(outcome, category, code, msg); }

        public boolean isRetryable() {
            return outcome == Outcome.RETRY;
        }
    }

    enum Outcome { RETRY, FAILED }
    enum Category { OPEN_CIRCUIT, RATE_LIMITED, BULKHEAD_FULL, TIMEOUT, IO, VENDOR_REJECTED, DELIVERY, UNKNOWN }
}
