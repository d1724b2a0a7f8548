package com.fastalert.core.notify;

import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import com.fastalert.exception.NotifyException;

import java.io.IOException;
import java.io.InterruptedIOException;

/**
 * Transport 之上的发送与状态码判定, 网络层失败统一为可重试
 */
public class WebhookSender {

    private final Transport transport;

    public WebhookSender(Transport transport) {
        this.transport = transport;
    }

    public WebhookResponse send(WebhookRequest request) throws NotifyException {
        return send(request, ResponseChecks.defaults());
    }

    public WebhookResponse send(WebhookRequest request, ResponseChecks checks) throws NotifyException {
        WebhookResponse response;
        try {
            response = transport.sendWebhook(request);
        } catch (InterruptedIOException e) {
            if (e.getCause() instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw NotifyException.retryable("request to " + safeUrl(request.getUrl()) + " aborted: " + e.getMessage(), e);
        } catch (IOException e) {
            throw NotifyException.retryable("failed to send request to " + safeUrl(request.getUrl()) + ": " + e.getMessage(), e);
        }
        return checks.check(response);
    }

    /**
     * 去掉 query, 避免 token 进入日志
     */
    static String safeUrl(String url) {
        if (url == null) {
            return "";
        }
        int i = url.indexOf('?');
        return i < 0 ? url : url.substring(0, i);
    }
}
