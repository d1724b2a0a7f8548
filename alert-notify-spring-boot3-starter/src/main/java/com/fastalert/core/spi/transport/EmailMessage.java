package com.fastalert.core.spi.transport;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

/**
 * 邮件发送请求
 */
@Getter
@Builder
public class EmailMessage {

    @Singular("recipient")
    private final List<String> to;

    private final String subject;

    private final String body;

    @Builder.Default
    private final boolean html = false;

    @Singular
    private final List<Attachment> attachments;

    @Getter
    @Builder
    public static class Attachment {
        private final String name;
        private final String contentType;
        private final byte[] content;
    }
}
