package com.fastalert.core.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * URL 拼接工具
 */
public final class UrlPaths {

    private UrlPaths() {}

    /**
     * 在 base 的 path 后追加相对路径, 保留 query
     * 解析失败时原样返回 base
     */
    public static String join(String base, String relative) {
        if (base == null || base.isEmpty()) {
            return relative;
        }
        try {
            URI u = new URI(base);
            String path = u.getRawPath() == null ? "" : u.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }
            String rel = relative.startsWith("/") ? relative : "/" + relative;
            StringBuilder sb = new StringBuilder();
            if (u.getScheme() != null) {
                sb.append(u.getScheme()).append("://");
            }
            if (u.getRawAuthority() != null) {
                sb.append(u.getRawAuthority());
            }
            sb.append(path).append(rel);
            if (u.getRawQuery() != null) {
                sb.append('?').append(u.getRawQuery());
            }
            return sb.toString();
        } catch (URISyntaxException e) {
            return base;
        }
    }

    /**
     * application/x-www-form-urlencoded, 保持 map 的迭代顺序
     */
    public static String form(Map<String, String> values) {
        StringBuilder sb = new StringBuilder();
        values.forEach((k, v) -> {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(queryEscape(k)).append('=').append(queryEscape(v));
        });
        return sb.toString();
    }

    public static String queryEscape(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    public static String pathEscape(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    public static String host(String url) {
        try {
            return new URI(url).getHost();
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
