package com.fastalert.core.transport;

import com.fastalert.core.spi.transport.EmailMessage;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.spi.transport.WebhookRequest;
import com.fastalert.core.spi.transport.WebhookResponse;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.RequestEntity;
import org.springframework.http.ResponseEntity;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.ResponseErrorHandler;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * 默认出站实现, HTTP 走 RestTemplate, 邮件走 JavaMailSender
 * 任意状态码都作为响应返回, 由调用方判定
 */
@Slf4j
public class RestTemplateTransport implements Transport {

    private final RestTemplate restTemplate;

    // 未配置邮件时为 null
    private final JavaMailSender mailSender;

    private final String mailFrom;

    public RestTemplateTransport(RestTemplate restTemplate, JavaMailSender mailSender, String mailFrom) {
        this.restTemplate = restTemplate;
        this.mailSender = mailSender;
        this.mailFrom = mailFrom;
    }

    /**
     * JDK HttpClient, 调用线程被中断时放弃请求
     */
    public static RestTemplate defaultRestTemplate(Duration connectTimeout, Duration readTimeout) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(client);
        factory.setReadTimeout(readTimeout);
        RestTemplate restTemplate = new RestTemplate(factory);
        restTemplate.setErrorHandler(new PassThroughErrorHandler());
        return restTemplate;
    }

    @Override
    public WebhookResponse sendWebhook(WebhookRequest request) throws IOException {
        URI uri;
        try {
            uri = URI.create(request.getUrl());
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid url: " + e.getMessage(), e);
        }
        HttpHeaders headers = new HttpHeaders();
        request.getHeaders().forEach(headers::set);
        if (headers.getContentType() == null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        if (request.hasBasicAuth()) {
            headers.setBasicAuth(request.getUser(), request.getPassword());
        } else if (request.getBearerToken() != null && !request.getBearerToken().isEmpty()) {
            headers.setBearerAuth(request.getBearerToken());
        }

        RequestEntity<byte[]> entity = new RequestEntity<>(request.getBody(), headers,
                HttpMethod.valueOf(request.getMethod()), uri);
        try {
            ResponseEntity<byte[]> resp = restTemplate.exchange(entity, byte[].class);
            log.debug("[Transport] {} {} -> {}", request.getMethod(), uri.getHost(), resp.getStatusCode().value());
            return new WebhookResponse(resp.getStatusCode().value(), resp.getBody());
        } catch (ResourceAccessException e) {
            throw unwrap(e);
        } catch (RestClientException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    private static IOException unwrap(ResourceAccessException e) {
        if (Thread.currentThread().isInterrupted()) {
            InterruptedIOException ie = new InterruptedIOException("request interrupted");
            ie.initCause(new InterruptedException(e.getMessage()));
            return ie;
        }
        if (e.getCause() instanceof IOException) {
            return (IOException) e.getCause();
        }
        return new IOException(e.getMessage(), e);
    }

    @Override
    public void sendEmail(EmailMessage message) throws IOException {
        if (mailSender == null) {
            throw new IOException("email is not configured: no JavaMailSender available");
        }
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, !message.getAttachments().isEmpty(), "UTF-8");
            if (mailFrom != null && !mailFrom.isEmpty()) {
                helper.setFrom(mailFrom);
            }
            helper.setTo(message.getTo().toArray(new String[0]));
            helper.setSubject(message.getSubject());
            helper.setText(message.getBody(), message.isHtml());
            for (EmailMessage.Attachment a : message.getAttachments()) {
                helper.addAttachment(a.getName(), new ByteArrayResource(a.getContent()), a.getContentType());
            }
            mailSender.send(mime);
            log.debug("[Transport] email sent, recipients={}", message.getTo().size());
        } catch (MessagingException | MailException e) {
            throw new IOException("failed to send email: " + e.getMessage(), e);
        }
    }

    /**
     * 不抛出 HttpStatusCodeException, 状态码交给 ResponseChecks
     */
    static class PassThroughErrorHandler implements ResponseErrorHandler {

        @Override
        public boolean hasError(ClientHttpResponse response) {
            return false;
        }

        @Override
        public void handleError(ClientHttpResponse response) {
            // hasError 恒为 false, 不会被调用
        }
    }
}
