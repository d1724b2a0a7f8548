package com.fastalert.core.spi;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * 载荷序列化 SPI
 */
public interface PayloadSerializer {

    byte[] serialize(Object payload);

    <T> T deserialize(byte[] json, TypeReference<T> typeRef);

    JsonNode readTree(byte[] json);

    JsonNode valueToTree(Object value);

    ObjectNode createObjectNode();
}
