package com.fastalert.core.receiver;

import com.fastalert.exception.ReceiverConfigException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 接收器 JSON 配置的只读视图
 */
public final class Settings {

    private final JsonNode node;

    private Settings(JsonNode node) {
        this.node = node;
    }

    public static Settings of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new Settings(JsonNodeFactory.instance.objectNode());
        }
        if (!node.isObject()) {
            throw new ReceiverConfigException("failed to unmarshal settings: expected object, got " + node.getNodeType());
        }
        return new Settings(node);
    }

    public boolean has(String key) {
        JsonNode v = node.get(key);
        return v != null && !v.isNull();
    }

    /** 缺失返回空串 */
    public String string(String key) {
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) {
            return "";
        }
        if (v.isContainerNode()) {
            throw new ReceiverConfigException("failed to unmarshal settings: field '" + key + "' must be a string");
        }
        return v.asText();
    }

    /** 空白时返回默认值 */
    public String string(String key, String defaultValue) {
        String v = string(key);
        return v.trim().isEmpty() ? defaultValue : v;
    }

    public boolean bool(String key) {
        return bool(key, false);
    }

    /** 缺失时返回默认值 */
    public boolean bool(String key, boolean defaultValue) {
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) {
            return defaultValue;
        }
        if (v.isBoolean()) {
            return v.booleanValue();
        }
        if (v.isTextual()) {
            return Boolean.parseBoolean(v.asText().trim());
        }
        throw new ReceiverConfigException("failed to unmarshal settings: field '" + key + "' must be a boolean");
    }

    public FlexibleNumber number(String key) {
        try {
            return FlexibleNumber.fromJson(node.get(key));
        } catch (IllegalArgumentException e) {
            throw new ReceiverConfigException("failed to unmarshal settings: field '" + key + "' " + e.getMessage(), e);
        }
    }

    public DelimitedList list(String key) {
        return DelimitedList.fromJson(node.get(key));
    }

    /**
     * JSON 字符串数组, 单个字符串视为一个元素
     */
    public List<String> strings(String key) {
        List<String> out = new ArrayList<>();
        JsonNode v = node.get(key);
        if (v == null || v.isNull()) {
            return out;
        }
        if (v.isArray()) {
            v.forEach(n -> out.add(n.asText()));
        } else if (v.isValueNode()) {
            out.add(v.asText());
        } else {
            throw new ReceiverConfigException("failed to unmarshal settings: field '" + key + "' must be a list of strings");
        }
        return out;
    }

    public Settings child(String key) {
        return of(node.get(key));
    }

    public Map<String, String> stringMap(String key) {
        Map<String, String> out = new LinkedHashMap<>();
        JsonNode v = node.get(key);
        if (v != null && v.isObject()) {
            v.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue().asText()));
        }
        return out;
    }

    public JsonNode raw(String key) {
        return node.get(key);
    }

    public JsonNode raw() {
        return node;
    }
}
