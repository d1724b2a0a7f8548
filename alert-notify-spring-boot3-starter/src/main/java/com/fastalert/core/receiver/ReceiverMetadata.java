package com.fastalert.core.receiver;

import com.fastalert.core.spi.notify.ReceiverInfo;
import lombok.Builder;
import lombok.Getter;

/**
 * 接收器公共元信息, 以组合方式持有于各 Notifier
 */
@Getter
@Builder
public final class ReceiverMetadata implements ReceiverInfo {

    private final String uid;

    private final String name;

    private final String type;

    private final boolean disableResolveMessage;

    @Override
    public String name() {
        return name;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public boolean disableResolve() {
        return disableResolveMessage;
    }

    @Override
    public String toString() {
        return type + ":" + name;
    }
}
