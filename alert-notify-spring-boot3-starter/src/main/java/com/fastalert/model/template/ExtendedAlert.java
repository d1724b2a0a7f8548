package com.fastalert.model.template;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * 模板中的单条告警视图
 */
@Data
public class ExtendedAlert {

    private String status;
    private KeyValues labels;
    private KeyValues annotations;
    private Instant startsAt;
    private Instant endsAt;
    private String generatorURL;
    private String fingerprint;
    private String silenceURL;
    private String dashboardURL;
    private String panelURL;
    private Map<String, Double> values;
    private String valueString;
    private String imageURL;

    @JsonIgnore
    public boolean isFiring() {
        return "firing".equals(status);
    }

    /**
     * 纯文本描述, 用于默认消息体
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Value: ").append(valueString == null || valueString.isEmpty() ? "[no value]" : valueString).append('\n');
        sb.append("Labels:\n");
        labels.forEach((k, v) -> sb.append(" - ").append(k).append(" = ").append(v).append('\n'));
        sb.append("Annotations:\n");
        annotations.forEach((k, v) -> sb.append(" - ").append(k).append(" = ").append(v).append('\n'));
        appendLink(sb, "Source", generatorURL);
        appendLink(sb, "Silence", silenceURL);
        appendLink(sb, "Dashboard", dashboardURL);
        appendLink(sb, "Panel", panelURL);
        return sb.toString();
    }

    private static void appendLink(StringBuilder sb, String title, String url) {
        if (url != null && !url.isEmpty()) {
            sb.append(title).append(": ").append(url).append('\n');
        }
    }
}
