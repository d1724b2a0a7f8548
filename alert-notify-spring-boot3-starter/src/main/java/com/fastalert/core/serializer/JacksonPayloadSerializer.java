package com.fastalert.core.serializer;

import com.fastalert.core.spi.PayloadSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;

public class JacksonPayloadSerializer implements PayloadSerializer {

    private final ObjectMapper mapper;

    public JacksonPayloadSerializer() {
        this(createDefaultMapper());
    }

    /** 允许外部传入自定义 ObjectMapper */
    public JacksonPayloadSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public byte[] serialize(Object payload) {
        try {
            return mapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload to JSON", e);
        }
    }

    @Override
    public <T> T deserialize(byte[] json, TypeReference<T> typeRef) {
        if (json == null || json.length == 0) {
            return null;
        }
        try {
            return mapper.readValue(json, typeRef);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to deserialize payload from JSON", e);
        }
    }

    @Override
    public JsonNode readTree(byte[] json) {
        try {
            return mapper.readTree(json == null ? new byte[0] : json);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to parse JSON", e);
        }
    }

    @Override
    public JsonNode valueToTree(Object value) {
        return mapper.valueToTree(value);
    }

    @Override
    public ObjectNode createObjectNode() {
        return mapper.createObjectNode();
    }

    public ObjectMapper getMapper() {
        return mapper;
    }

    public static ObjectMapper createDefaultMapper() {
        ObjectMapper m = new ObjectMapper();
        // 时间按 RFC3339 字符串输出
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 反序列化忽略未知字段，增强前后兼容
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        m.enable(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT);
        // 自动发现（如 JDK8 Optional、JSR310 等）
        m.findAndRegisterModules();
        return m;
    }
}
