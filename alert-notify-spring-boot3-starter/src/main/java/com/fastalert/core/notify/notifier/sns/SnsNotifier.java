package com.fastalert.core.notify.notifier.sns;

import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.SnsClientFactory;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.template.Truncations;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.sns.SnsClient;
import software.amazon.awssdk.services.sns.model.MessageAttributeValue;
import software.amazon.awssdk.services.sns.model.PublishRequest;
import software.amazon.awssdk.services.sns.model.PublishResponse;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AWS SNS 发布
 * 短信正文上限 1600 字节, 其余 256KB; 主题上限 100 字符; 截断时附加消息属性
 */
@Slf4j
public class SnsNotifier implements Notifier {

    public static final String TYPE = "sns";

    static final int MAX_SMS_BYTES = 1600;

    static final int MAX_MESSAGE_BYTES = 256 * 1024;

    static final int MAX_SUBJECT_CHARS = 100;

    static final String ATTR_TRUNCATED = "truncated";

    static final String ATTR_SUBJECT_TRUNCATED = "subject_truncated";

    private final ReceiverMetadata meta;

    private final SnsConfig conf;

    private final TemplateRenderer renderer;

    private final SnsClientFactory clients;

    private final Clock clock;

    public SnsNotifier(ReceiverMetadata meta, SnsConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.clients = deps.getSnsClientFactory();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        PublishRequest request = buildRequest(ctx, NotifySupport.group(ctx, alerts, clock));
        log.debug("[Notify-sns] receiver={} topicArn={} targetArn={}", name(), request.topicArn(), request.targetArn());

        try (SnsClient client = clients.newClient(conf.getConnect())) {
            PublishResponse response = client.publish(request);
            log.debug("[Notify-sns] receiver={} published messageId={}", name(), response.messageId());
        } catch (AwsServiceException e) {
            boolean retry = e.statusCode() >= 500 || e.isThrottlingException();
            throw new NotifyException("failed to publish SNS message: " + e.getMessage(), retry, e);
        } catch (SdkClientException e) {
            throw NotifyException.retryable("failed to publish SNS message: " + e.getMessage(), e);
        } catch (SdkException e) {
            throw NotifyException.permanent("failed to publish SNS message: " + e.getMessage(), e);
        }
    }

    PublishRequest buildRequest(NotifyContext ctx, AlertGroup group) {
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        PublishRequest.Builder req = PublishRequest.builder();
        Map<String, MessageAttributeValue> attributes = new LinkedHashMap<>();
        conf.getAttributes().forEach((k, v) -> attributes.put(k, stringAttribute(v)));

        if (!conf.getTopicArn().isEmpty()) {
            String topicArn = tmpl.expand(conf.getTopicArn());
            req.topicArn(topicArn);
            // FIFO 主题要求去重 id 与分组 id
            if (topicArn.endsWith(".fifo")) {
                String key = ctx.getGroupKey().hash();
                req.messageDeduplicationId(key).messageGroupId(key);
            }
        }
        if (!conf.getTargetArn().isEmpty()) {
            req.targetArn(tmpl.expand(conf.getTargetArn()));
        }

        String message = tmpl.expand(conf.getMessage());
        int limit = MAX_MESSAGE_BYTES;
        if (!conf.getPhoneNumber().isEmpty()) {
            req.phoneNumber(tmpl.expand(conf.getPhoneNumber()));
            limit = MAX_SMS_BYTES;
        }
        Truncations.Truncated body = Truncations.cutBytes(message, limit);
        if (body.truncated()) {
            attributes.put(ATTR_TRUNCATED, stringAttribute("true"));
        }
        req.message(body.value());

        String subject = tmpl.expand(conf.getSubject());
        if (!subject.isEmpty()) {
            if (subject.codePointCount(0, subject.length()) > MAX_SUBJECT_CHARS) {
                subject = subject.substring(0, subject.offsetByCodePoints(0, MAX_SUBJECT_CHARS));
                attributes.put(ATTR_SUBJECT_TRUNCATED, stringAttribute("true"));
            }
            req.subject(subject);
        }
        NotifySupport.warnTemplateErrors(this, tmpl);

        if (!attributes.isEmpty()) {
            req.messageAttributes(attributes);
        }
        return req.build();
    }

    private static MessageAttributeValue stringAttribute(String value) {
        return MessageAttributeValue.builder().dataType("String").stringValue(value).build();
    }

    @Override
    public String name() {
        return meta.name();
    }

    @Override
    public String type() {
        return meta.type();
    }

    @Override
    public boolean disableResolve() {
        return meta.disableResolve();
    }
}
