package com.fastalert.core.spi.notify;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.receiver.Settings;

/**
 * 按类型创建 Notifier, 配置不合法时抛出 ReceiverConfigException
 */
public interface NotifierFactory {

    String type();

    Notifier create(ReceiverMetadata meta, Settings settings, DecryptFunction decrypt, NotifierDependencies deps);

    static NotifierFactory of(String type, Creator creator) {
        return new NotifierFactory() {
            @Override
            public String type() {
                return type;
            }

            @Override
            public Notifier create(ReceiverMetadata meta, Settings settings, DecryptFunction decrypt, NotifierDependencies deps) {
                return creator.create(meta, settings, decrypt, deps);
            }
        };
    }

    @FunctionalInterface
    interface Creator {
        Notifier create(ReceiverMetadata meta, Settings settings, DecryptFunction decrypt, NotifierDependencies deps);
    }
}
