package com.fastalert.core.notify.notifier.kafka;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 写入 topic 的单条记录
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class KafkaRecord {

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String description;

    private String client;

    private String details;

    @JsonProperty("alert_state")
    private String alertState;

    @JsonProperty("client_url")
    private String clientUrl;

    private List<Context> contexts = new ArrayList<>();

    @JsonProperty("incident_key")
    private String incidentKey;

    @Data
    public static class Context {
        private final String type;
        @JsonProperty("src")
        private final String source;
    }
}
