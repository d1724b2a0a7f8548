package com.fastalert.core.receiver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 从外部来源重新读取密码, 凭据可能在两次发送之间轮换
 */
@FunctionalInterface
public interface PasswordSource {

    String read(String location) throws IOException;

    static PasswordSource files() {
        return location -> Files.readString(Path.of(location), StandardCharsets.UTF_8).trim();
    }
}
