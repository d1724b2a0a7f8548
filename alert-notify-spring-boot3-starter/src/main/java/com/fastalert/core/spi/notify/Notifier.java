package com.fastalert.core.spi.notify;

import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;

import java.util.List;

/**
 * 告警通知器, 每个接收器实例一个
 */
public interface Notifier extends ReceiverInfo {

    /**
     * 派发一次通知, 同步方法 框架层负责并发与重试调度
     *
     * @throws NotifyException 投递失败, isRetryable() 表示调用方是否应稍后重试
     */
    void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException;

    /**
     * 是否发送恢复通知
     */
    default boolean sendResolved() {
        return !disableResolve();
    }
}
