package com.fastalert.core.spi.image;

import com.fastalert.model.Alert;

import java.io.IOException;
import java.util.Optional;

/**
 * 告警截图查询, 失败只影响图片增强
 */
public interface ImageProvider {

    Optional<AlertImage> imageFor(Alert alert) throws IOException;

    static ImageProvider unavailable() {
        return alert -> Optional.empty();
    }
}
