package com.fastalert.core.notify.notifier.email;

import com.fastalert.core.notify.Images;
import com.fastalert.core.notify.NotifierDependencies;
import com.fastalert.core.notify.NotifySupport;
import com.fastalert.core.receiver.ReceiverMetadata;
import com.fastalert.core.spi.notify.Notifier;
import com.fastalert.core.spi.transport.EmailMessage;
import com.fastalert.core.spi.transport.Transport;
import com.fastalert.core.template.TemplateExpander;
import com.fastalert.core.template.TemplateRenderer;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.exception.NotifyException;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * 邮件通知
 * singleEmail 时所有收件人共用一封, 否则每个地址单独发送
 */
@Slf4j
public class EmailNotifier implements Notifier {

    public static final String TYPE = "email";

    private final ReceiverMetadata meta;

    private final EmailConfig conf;

    private final TemplateRenderer renderer;

    private final Transport transport;

    private final Images images;

    private final Clock clock;

    public EmailNotifier(ReceiverMetadata meta, EmailConfig conf, NotifierDependencies deps) {
        this.meta = meta;
        this.conf = conf;
        this.renderer = deps.getRenderer();
        this.transport = deps.getTransport();
        this.images = deps.getImages();
        this.clock = deps.getClock();
    }

    @Override
    public void notify(NotifyContext ctx, List<Alert> alerts) throws NotifyException {
        AlertGroup group = NotifySupport.group(ctx, alerts, clock);
        for (EmailMessage message : buildMessages(ctx, group)) {
            try {
                transport.sendEmail(message);
            } catch (InterruptedIOException e) {
                if (e.getCause() instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                throw NotifyException.retryable("sending email aborted: " + e.getMessage(), e);
            } catch (IOException e) {
                throw NotifyException.retryable("failed to send email: " + e.getMessage(), e);
            }
        }
    }

    List<EmailMessage> buildMessages(NotifyContext ctx, AlertGroup group) {
        TemplateExpander tmpl = renderer.newExpander(ctx, group);
        String subject = tmpl.expand(conf.getSubject());
        String ruleUrl = UrlPaths.join(tmpl.externalUrl(), "/alerting/list");
        String body = tmpl.expand(conf.getMessage())
                + "\n\n" + "View alert rules: " + ruleUrl
                + "\n" + "Firing alerts: " + ruleUrl + "?alertState=firing&view=state\n";
        NotifySupport.warnTemplateErrors(this, tmpl);

        List<EmailMessage.Attachment> attachments = new ArrayList<>();
        images.forEachStoredImage(group.getAlerts(), (i, alert, image) -> {
            if (image.hasContent()) {
                attachments.add(EmailMessage.Attachment.builder()
                        .name(image.getFileName())
                        .contentType("image/png")
                        .content(image.getContent())
                        .build());
            }
            return true;
        });

        List<EmailMessage> out = new ArrayList<>();
        if (conf.isSingleEmail()) {
            out.add(message(conf.getAddresses(), subject, body, attachments));
        } else {
            for (String address : conf.getAddresses()) {
                out.add(message(List.of(address), subject, body, attachments));
            }
        }
        log.debug("[Notify-email] receiver={} messages={} attachments={}", name(), out.size(), attachments.size());
        return out;
    }

    private static EmailMessage message(List<String> to, String subject, String body, List<EmailMessage.Attachment> attachments) {
        return EmailMessage.builder()
                .to(to)
                .subject(subject)
                .body(body)
                .attachments(attachments)
                .build();
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
