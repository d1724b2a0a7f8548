package com.fastalert.support;

import com.fastalert.core.spi.transport.EmailMessage;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录所有出站请求, 按入队顺序回放响应, 队列为空时返回 200
 */
public class RecordingTransport implements Transport {

    private final List<WebhookRequest> requests = new CopyOnWriteArrayList<>();

    private final List<EmailMessage> emails = new CopyOnWriteArrayList<>();

    private final Queue<Object> responses = new ConcurrentLinkedQueue<>();

    private volatile long delayMillis;

    public RecordingTransport respond(int status, String body) {
        responses.add(new WebhookResponse(status, body.getBytes(StandardCharsets.UTF_8)));
        return this;
    }

    public RecordingTransport fail(IOException e) {
        responses.add(e);
        return this;
    }

    public RecordingTransport delay(long millis) {
        this.delayMillis = millis;
        return this;
    }

    @Override
    public WebhookResponse sendWebhook(WebhookRequest request) throws IOException {
        requests.add(request);
        if (delayMillis > 0) {
            try {
                Thread.sleep(delayMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted");
            }
        }
        Object next = responses.poll();
        if (next instanceof IOException) {
            throw (IOException) next;
        }
        return next == null ? new WebhookResponse(200, new byte[0]) : (WebhookResponse) next;
    }

    @Override
    public void sendEmail(EmailMessage message) {
        emails.add(message);
    }

    public List<WebhookRequest> requests() {
        return new ArrayList<>(requests);
    }

    public WebhookRequest request(int i) {
        return requests.get(i);
    }

    public WebhookRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    public List<EmailMessage> emails() {
        return new ArrayList<>(emails);
    }
}
