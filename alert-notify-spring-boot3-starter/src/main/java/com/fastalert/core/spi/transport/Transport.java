package com.fastalert.core.spi.transport;

import java.io.IOException;

/**
 * 出站调用, 由外部实现
 * 同步阻塞, 线程被中断时应尽快放弃进行中的调用
 */
public interface Transport {

    /**
     * 任意状态码都返回响应, 只有网络层失败才抛出
     */
    WebhookResponse sendWebhook(WebhookRequest request) throws IOException;

    void sendEmail(EmailMessage message) throws IOException;
}
