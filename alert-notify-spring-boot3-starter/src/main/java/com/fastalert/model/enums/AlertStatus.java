package com.fastalert.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 告警状态
 */
public enum AlertStatus {

    FIRING("firing"),

    RESOLVED("resolved");

    private final String value;

    AlertStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
