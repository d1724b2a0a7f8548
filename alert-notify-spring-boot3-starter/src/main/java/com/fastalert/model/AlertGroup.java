package com.fastalert.model;

import com.fastalert.model.enums.AlertStatus;
import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * 一次通知的告警分组, 非空, 保持调用方顺序
 */
@Getter
public final class AlertGroup {

    private final GroupKey groupKey;

    private final List<Alert> alerts;

    private final Instant evaluatedAt;

    private final AlertStatus status;

    private AlertGroup(GroupKey groupKey, List<Alert> alerts, Instant evaluatedAt) {
        this.groupKey = groupKey;
        this.alerts = alerts;
        this.evaluatedAt = evaluatedAt;
        // 全部恢复才算恢复
        this.status = alerts.stream().allMatch(a -> a.isResolved(evaluatedAt)) ? AlertStatus.RESOLVED : AlertStatus.FIRING;
    }

    public static AlertGroup of(GroupKey groupKey, List<Alert> alerts, Instant now) {
        if (groupKey == null) {
            throw new IllegalArgumentException("group key is required");
        }
        if (alerts == null || alerts.isEmpty()) {
            throw new IllegalArgumentException("alert group must contain at least one alert");
        }
        return new AlertGroup(groupKey, List.copyOf(alerts), now);
    }

    public boolean isResolved() {
        return status == AlertStatus.RESOLVED;
    }

    public long firingCount() {
        return alerts.stream().filter(a -> !a.isResolved(evaluatedAt)).count();
    }

    public long resolvedCount() {
        return alerts.size() - firingCount();
    }

    public int size() {
        return alerts.size();
    }
}
