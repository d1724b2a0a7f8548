package com.fastalert.core.spi.transport;

import java.security.SecureRandom;
import java.util.HexFormat;

/**
 * multipart 分隔符生成
 */
@FunctionalInterface
public interface BoundaryGenerator {

    String next();

    static BoundaryGenerator random() {
        SecureRandom random = new SecureRandom();
        return () -> {
            byte[] b = new byte[30];
            random.nextBytes(b);
            return HexFormat.of().formatHex(b);
        };
    }
}
