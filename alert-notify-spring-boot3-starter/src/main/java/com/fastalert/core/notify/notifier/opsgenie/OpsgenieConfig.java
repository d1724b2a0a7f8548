package com.fastalert.core.notify.notifier.opsgenie;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class OpsgenieConfig {

    public static final String DEFAULT_ALERTS_URL = "https://api.opsgenie.com/v2/alerts";

    public enum SendTagsAs {
        TAGS, DETAILS, BOTH;

        static SendTagsAs parse(String raw) {
            switch (raw) {
                case "":
                case "tags":
                    return TAGS;
                case "details":
                    return DETAILS;
                case "both":
                    return BOTH;
                default:
                    throw new ReceiverConfigException("invalid value for sendTagsAs: \"" + raw + "\"");
            }
        }
    }

    private final String apiKey;

    private final String apiUrl;

    private final String message;

    private final String description;

    // 恢复时是否关闭告警, 与 disableResolveMessage 相互独立
    private final boolean autoClose;

    private final boolean overridePriority;

    private final SendTagsAs sendTagsAs;

    public static OpsgenieConfig parse(Settings s, DecryptFunction decrypt) {
        String apiKey = ConfigChecks.require(decrypt.decrypt("apiKey", s.string("apiKey")),
                "could not find api key property in settings");
        return OpsgenieConfig.builder()
                .apiKey(apiKey)
                .apiUrl(s.string("apiUrl", DEFAULT_ALERTS_URL))
                .message(s.string("message", DefaultTemplates.TITLE))
                .description(s.string("description"))
                .autoClose(s.bool("autoClose", true))
                .overridePriority(s.bool("overridePriority", true))
                .sendTagsAs(SendTagsAs.parse(s.string("sendTagsAs")))
                .build();
    }

    public boolean sendDetails() {
        return sendTagsAs == SendTagsAs.DETAILS || sendTagsAs == SendTagsAs.BOTH;
    }

    public boolean sendTags() {
        return sendTagsAs == SendTagsAs.TAGS || sendTagsAs == SendTagsAs.BOTH;
    }

    @Override
    public String toString() {
        return "OpsgenieConfig{apiUrl=" + apiUrl + ", autoClose=" + autoClose + ", sendTagsAs=" + sendTagsAs + "}";
    }
}
