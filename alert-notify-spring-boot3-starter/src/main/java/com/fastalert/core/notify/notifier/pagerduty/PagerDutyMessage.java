package com.fastalert.core.notify.notifier.pagerduty;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Events API v2 请求体
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class PagerDutyMessage {

    @JsonProperty("routing_key")
    private String routingKey;

    @JsonProperty("dedup_key")
    private String dedupKey;

    @JsonProperty("event_action")
    @JsonInclude(JsonInclude.Include.ALWAYS)
    private String eventAction;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private Payload payload;

    private String client;

    @JsonProperty("client_url")
    private String clientUrl;

    private List<Link> links = new ArrayList<>();

    private List<Image> images = new ArrayList<>();

    @Data
    public static class Payload {
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String summary;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String source;
        @JsonInclude(JsonInclude.Include.ALWAYS)
        private String severity;
        @JsonProperty("class")
        private String clazz;
        private String component;
        private String group;
        @JsonProperty("custom_details")
        private Map<String, String> customDetails;
    }

    @Data
    public static class Link {
        private final String href;
        private final String text;
    }

    @Data
    public static class Image {
        private final String src;
    }
}
