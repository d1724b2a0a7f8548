package com.fastalert.core.receiver;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * 兼容 JSON 数字或字符串的数值配置
 */
public final class FlexibleNumber {

    private static final FlexibleNumber EMPTY = new FlexibleNumber("");

    private final String raw;

    private FlexibleNumber(String raw) {
        this.raw = raw;
    }

    public static FlexibleNumber of(String raw) {
        return raw == null || raw.trim().isEmpty() ? EMPTY : new FlexibleNumber(raw.trim());
    }

    public static FlexibleNumber of(long value) {
        return new FlexibleNumber(Long.toString(value));
    }

    /**
     * 缺失或 null 为空值, 数字与字符串均可, 其它类型视为配置错误
     */
    public static FlexibleNumber fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return EMPTY;
        }
        if (node.isNumber() || node.isTextual()) {
            return of(node.asText());
        }
        throw new IllegalArgumentException("expected number or string, got " + node.getNodeType());
    }

    public boolean isEmpty() {
        return raw.isEmpty();
    }

    /**
     * @throws NumberFormatException 为空或不是整数
     */
    public long asInt64() {
        if (raw.isEmpty()) {
            throw new NumberFormatException("empty number");
        }
        return Long.parseLong(raw);
    }

    public long asInt64(long defaultValue) {
        return raw.isEmpty() ? defaultValue : asInt64();
    }

    public String raw() {
        return raw;
    }

    @Override
    public String toString() {
        return raw;
    }
}
