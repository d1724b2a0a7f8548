package com.fastalert.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.TreeMap;

/**
 * 告警分组键
 * hash() 作为外部系统的去重标识 (dedup_key / alias / incident_key / JIRA 标签)
 */
public final class GroupKey {

    private final String value;

    private volatile String hash;

    private GroupKey(String value) {
        this.value = value;
    }

    public static GroupKey of(String value) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException("group key must not be empty");
        }
        return new GroupKey(value);
    }

    /**
     * 由分组标签构造规范形式 {k1="v1", k2="v2"}, 按 key 排序, 与遍历顺序无关
     */
    public static GroupKey fromLabels(Map<String, String> groupLabels) {
        StringJoiner joiner = new StringJoiner(", ", "{", "}");
        new TreeMap<>(groupLabels).forEach((k, v) -> joiner.add(k + "=\"" + escape(v) + "\""));
        return new GroupKey(joiner.toString());
    }

    /**
     * SHA-256 十六进制
     */
    public String hash() {
        String h = hash;
        if (h == null) {
            h = sha256Hex(value);
            hash = h;
        }
        return h;
    }

    public String value() {
        return value;
    }

    static String sha256Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(s.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String escape(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GroupKey)) return false;
        return value.equals(((GroupKey) o).value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
