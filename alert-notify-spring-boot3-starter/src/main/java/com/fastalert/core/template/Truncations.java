package com.fastalert.core.template;

import java.nio.charset.StandardCharsets;

/**
 * 按码点/字节截断, 不拆分多字节字符
 */
public final class Truncations {

    public static final String ELLIPSIS = "…";

    private Truncations() {}

    /**
     * 保留 n 个码点, 超长时末位替换为省略号
     */
    public static Truncated inRunes(String s, int n) {
        int count = s.codePointCount(0, s.length());
        if (count <= n) {
            return new Truncated(s, false);
        }
        if (n <= 3) {
            return new Truncated(s.substring(0, s.offsetByCodePoints(0, Math.max(n, 0))), true);
        }
        return new Truncated(s.substring(0, s.offsetByCodePoints(0, n - 1)) + ELLIPSIS, true);
    }

    /**
     * 按 UTF-8 字节数截断, 结果不超过 n 字节 (含省略号的 3 字节)
     */
    public static Truncated inBytes(String s, int n) {
        byte[] bytes = s.getBytes(StandardCharsets.UTF_8);
        if (bytes.length <= n) {
            return new Truncated(s, false);
        }
        if (n < 3) {
            return new Truncated(".".repeat(Math.max(n, 0)), true);
        }
        int budget = n - ELLIPSIS.getBytes(StandardCharsets.UTF_8).length;
        return new Truncated(s.substring(0, prefixWithin(s, budget)) + ELLIPSIS, true);
    }

    /**
     * 按 UTF-8 字节数截断, 不拆分多字节字符, 不追加省略号
     */
    public static Truncated cutBytes(String s, int n) {
        if (s.getBytes(StandardCharsets.UTF_8).length <= n) {
            return new Truncated(s, false);
        }
        return new Truncated(s.substring(0, prefixWithin(s, Math.max(n, 0))), true);
    }

    // 不超过 budget 字节的最长前缀的 char 下标
    private static int prefixWithin(String s, int budget) {
        int used = 0;
        int end = 0;
        while (end < s.length()) {
            int cp = s.codePointAt(end);
            int len = utf8Length(cp);
            if (used + len > budget) {
                break;
            }
            used += len;
            end += Character.charCount(cp);
        }
        return end;
    }

    private static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }

    public static final class Truncated {
        private final String value;
        private final boolean truncated;

        Truncated(String value, boolean truncated) {
            this.value = value;
            this.truncated = truncated;
        }

        public String value() { return value; }

        public boolean truncated() { return truncated; }
    }
}
