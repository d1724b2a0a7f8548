package com.fastalert.core.notify.notifier.jira;

import com.fastalert.core.receiver.ConfigChecks;
import com.fastalert.core.receiver.DecryptFunction;
import com.fastalert.core.receiver.Settings;
import com.fastalert.core.template.DefaultTemplates;
import com.fastalert.exception.ReceiverConfigException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Getter
@Builder
public class JiraConfig {

    private static final Pattern DEDUP_FIELD = Pattern.compile("[0-9]+");

    private static final Pattern DURATION = Pattern.compile("(\\d+)(ms|s|m|h|d|w|y)");

    private final URI url;

    private final String project;

    private final String summary;

    private final String description;

    @Singular
    private final List<String> labels;

    private final String priority;

    private final String issueType;

    private final String reopenTransition;

    private final String resolveTransition;

    private final String wontFixResolution;

    // 零表示不限制
    private final Duration reopenDuration;

    // 保存分组哈希的自定义字段 ID, 为空时使用 ALERT{hash} 标签
    private final String dedupKeyFieldName;

    private final Map<String, JsonNode> fields;

    private final String user;

    private final String password;

    private final String token;

    public static JiraConfig parse(Settings s, DecryptFunction decrypt) {
        URI url = ConfigChecks.requireUrl(s.string("api_url"), "api_url");

        Duration reopen = Duration.ZERO;
        String rawDuration = s.string("reopen_duration");
        if (!rawDuration.isEmpty()) {
            reopen = parseDuration(rawDuration);
        }
        String project = ConfigChecks.require(s.string("project"), "missing project in jira_config");
        String issueType = ConfigChecks.require(s.string("issue_type"), "missing issue_type in jira_config");

        String dedupField = s.string("dedup_key_field");
        if (!dedupField.isEmpty() && !DEDUP_FIELD.matcher(dedupField).matches()) {
            throw new ReceiverConfigException("dedup_key_field must match the format [0-9]+");
        }

        String user = decrypt.decrypt("user", s.string("user"));
        String password = decrypt.decrypt("password", s.string("password"));
        String token = decrypt.decrypt("api_token", s.string("api_token"));
        boolean hasBasic = !user.isEmpty() || !password.isEmpty();
        if (!token.isEmpty() && hasBasic) {
            throw new ReceiverConfigException("provided both token and user/password, only one is allowed at a time");
        }
        if (token.isEmpty() && (user.isEmpty() || password.isEmpty())) {
            throw new ReceiverConfigException("either token or both user and password must be set");
        }

        Map<String, JsonNode> fields = new LinkedHashMap<>();
        JsonNode rawFields = s.raw("fields");
        if (rawFields != null && rawFields.isObject()) {
            rawFields.fields().forEachRemaining(e -> fields.put(e.getKey(), e.getValue()));
        }

        return JiraConfig.builder()
                .url(url)
                .project(project)
                .issueType(issueType)
                .summary(s.string("summary", DefaultTemplates.JIRA_SUMMARY))
                .description(s.string("description", DefaultTemplates.JIRA_DESCRIPTION))
                .priority(s.string("priority", DefaultTemplates.JIRA_PRIORITY))
                .labels(s.strings("labels"))
                .reopenTransition(s.string("reopen_transition"))
                .resolveTransition(s.string("resolve_transition"))
                .wontFixResolution(s.string("wont_fix_resolution"))
                .reopenDuration(reopen)
                .dedupKeyFieldName(dedupField)
                .fields(fields)
                .user(user)
                .password(password)
                .token(token)
                .build();
    }

    /**
     * Prometheus 风格时长, 如 1h30m
     */
    static Duration parseDuration(String raw) {
        Matcher m = DURATION.matcher(raw);
        Duration total = Duration.ZERO;
        int pos = 0;
        while (m.find() && m.start() == pos) {
            long n = Long.parseLong(m.group(1));
            switch (m.group(2)) {
                case "ms" -> total = total.plusMillis(n);
                case "s" -> total = total.plusSeconds(n);
                case "m" -> total = total.plusMinutes(n);
                case "h" -> total = total.plusHours(n);
                case "d" -> total = total.plusDays(n);
                case "w" -> total = total.plusDays(n * 7);
                default -> total = total.plusDays(n * 365);
            }
            pos = m.end();
        }
        if (pos == 0 || pos != raw.length()) {
            throw new ReceiverConfigException("field reopen_duration is not a valid duration: " + raw);
        }
        return total;
    }

    /**
     * api_url 以 /3 结尾时使用 v3 API
     */
    public boolean isV3() {
        String path = url.getPath();
        return path != null && path.endsWith("/3");
    }

    public boolean hasDedupKeyField() {
        return !dedupKeyFieldName.isEmpty();
    }

    @Override
    public String toString() {
        return "JiraConfig{url=" + url + ", project=" + project + ", issueType=" + issueType + "}";
    }
}
