package com.fastalert.core.spi.image;

import lombok.Builder;
import lombok.Getter;

/**
 * 截图, 可能只有 URL 或只有内容
 */
@Getter
@Builder
public class AlertImage {

    private final String url;

    private final String fileName;

    private final byte[] content;

    public boolean hasUrl() {
        return url != null && !url.isEmpty();
    }

    public boolean hasContent() {
        return content != null && content.length > 0;
    }
}
