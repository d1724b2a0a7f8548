package com.fastalert.model;

import com.fastalert.model.enums.AlertStatus;
import lombok.Builder;
import lombok.Getter;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 单条告警, 进入通知链路后不可变
 */
@Getter
public final class Alert {

    /** Grafana 截图 token 注解 */
    public static final String IMAGE_TOKEN_ANNOTATION = "__alertImageToken__";

    public static final String ALERT_NAME_LABEL = "alertname";

    private static final long FNV_OFFSET = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;
    private static final byte SEPARATOR = (byte) 0xff;

    private final Map<String, String> labels;
    private final Map<String, String> annotations;
    private final Instant startsAt;
    // 为空表示仍在触发
    private final Instant endsAt;
    private final String generatorURL;

    @Builder(toBuilder = true)
    private Alert(Map<String, String> labels, Map<String, String> annotations,
                  Instant startsAt, Instant endsAt, String generatorURL) {
        this.labels = labels == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(labels));
        this.annotations = annotations == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(annotations));
        this.startsAt = startsAt;
        this.endsAt = endsAt;
        this.generatorURL = generatorURL == null ? "" : generatorURL;
    }

    public AlertStatus status(Instant now) {
        return endsAt != null && !endsAt.isAfter(now) ? AlertStatus.RESOLVED : AlertStatus.FIRING;
    }

    public boolean isResolved(Instant now) {
        return status(now) == AlertStatus.RESOLVED;
    }

    public String name() {
        return labels.getOrDefault(ALERT_NAME_LABEL, "");
    }

    public String imageToken() {
        return annotations.getOrDefault(IMAGE_TOKEN_ANNOTATION, "");
    }

    /**
     * 复制一份并追加注解, 原对象不变
     */
    public Alert withAnnotation(String key, String value) {
        Map<String, String> copy = new TreeMap<>(annotations);
        copy.put(key, value);
        return toBuilder().annotations(copy).build();
    }

    /**
     * 64 位 FNV-1a, 与 Prometheus 标签指纹一致
     */
    public String fingerprint() {
        long h = FNV_OFFSET;
        for (Map.Entry<String, String> e : labels.entrySet()) {
            h = fnv(h, e.getKey().getBytes(StandardCharsets.UTF_8));
            h = fnv(h, SEPARATOR);
            h = fnv(h, e.getValue().getBytes(StandardCharsets.UTF_8));
            h = fnv(h, SEPARATOR);
        }
        return String.format("%016x", h);
    }

    private static long fnv(long h, byte[] bytes) {
        for (byte b : bytes) {
            h = fnv(h, b);
        }
        return h;
    }

    private static long fnv(long h, byte b) {
        h ^= (b & 0xff);
        return h * FNV_PRIME;
    }

    @Override
    public String toString() {
        return "Alert" + labels;
    }
}
