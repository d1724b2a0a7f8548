package com.fastalert.core.template;

import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.core.util.UrlPaths;
import com.fastalert.model.Alert;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.template.ExtendedAlert;
import com.fastalert.model.template.ExtendedAlerts;
import com.fastalert.model.template.ExtendedData;
import com.fastalert.model.template.KeyValues;
import com.fasterxml.jackson.core.type.TypeReference;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 由告警分组构建模板根对象
 */
@Slf4j
public class ExtendedDataBuilder {

    public static final String DASHBOARD_UID_ANNOTATION = "__dashboardUid__";
    public static final String PANEL_ID_ANNOTATION = "__panelId__";
    public static final String VALUES_ANNOTATION = "__values__";
    public static final String VALUE_STRING_ANNOTATION = "__value_string__";

    private static final TypeReference<Map<String, Double>> VALUES_TYPE = new TypeReference<>() {};

    private final PayloadSerializer serializer;

    public ExtendedDataBuilder(PayloadSerializer serializer) {
        this.serializer = serializer;
    }

    public ExtendedData build(String receiver, AlertGroup group, Map<String, String> groupLabels, String externalUrl) {
        ExtendedAlerts alerts = new ExtendedAlerts();
        for (Alert a : group.getAlerts()) {
            alerts.add(extend(a, group, externalUrl));
        }
        ExtendedData data = new ExtendedData();
        data.setReceiver(receiver);
        data.setStatus(group.getStatus().value());
        data.setAlerts(alerts);
        data.setGroupLabels(new KeyValues(groupLabels));
        data.setCommonLabels(KeyValues.withoutPrivate(common(group.getAlerts(), true)));
        data.setCommonAnnotations(KeyValues.withoutPrivate(common(group.getAlerts(), false)));
        data.setExternalURL(externalUrl == null ? "" : externalUrl);
        return data;
    }

    private ExtendedAlert extend(Alert alert, AlertGroup group, String externalUrl) {
        ExtendedAlert ea = new ExtendedAlert();
        ea.setStatus(alert.status(group.getEvaluatedAt()).value());
        ea.setLabels(KeyValues.withoutPrivate(alert.getLabels()));
        ea.setAnnotations(KeyValues.withoutPrivate(alert.getAnnotations()));
        ea.setStartsAt(alert.getStartsAt());
        ea.setEndsAt(alert.getEndsAt());
        ea.setGeneratorURL(alert.getGeneratorURL());
        ea.setFingerprint(alert.fingerprint());

        Map<String, String> annotations = alert.getAnnotations();
        String valuesJson = annotations.get(VALUES_ANNOTATION);
        if (valuesJson != null) {
            try {
                ea.setValues(serializer.deserialize(valuesJson.getBytes(StandardCharsets.UTF_8), VALUES_TYPE));
            } catch (IllegalStateException e) {
                log.warn("[Template] failed to unmarshal values annotation, alert={}", alert.name(), e);
            }
        }
        ea.setValueString(annotations.getOrDefault(VALUE_STRING_ANNOTATION, ""));

        if (externalUrl == null || externalUrl.isEmpty()) {
            return ea;
        }
        String dashboardUid = annotations.get(DASHBOARD_UID_ANNOTATION);
        if (dashboardUid != null && !dashboardUid.isEmpty()) {
            ea.setDashboardURL(UrlPaths.join(externalUrl, "/d/" + dashboardUid));
            String panelId = annotations.get(PANEL_ID_ANNOTATION);
            if (panelId != null && !panelId.isEmpty()) {
                ea.setPanelURL(withQuery(UrlPaths.join(externalUrl, "/d/" + dashboardUid), "viewPanel=" + UrlPaths.queryEscape(panelId)));
            }
        }
        ea.setSilenceURL(silenceUrl(alert, externalUrl));
        return ea;
    }

    private static String silenceUrl(Alert alert, String externalUrl) {
        StringBuilder query = new StringBuilder("alertmanager=grafana");
        alert.getLabels().forEach((k, v) -> {
            if (!KeyValues.isPrivate(k)) {
                query.append("&matcher=").append(UrlPaths.queryEscape(k + "=" + v));
            }
        });
        return withQuery(UrlPaths.join(stripQuery(externalUrl), "/alerting/silence/new"), query.toString());
    }

    private static String stripQuery(String url) {
        int i = url.indexOf('?');
        return i < 0 ? url : url.substring(0, i);
    }

    private static String withQuery(String url, String query) {
        return stripQuery(url) + "?" + query;
    }

    /**
     * 所有告警共有且取值相同的键值
     */
    private static Map<String, String> common(List<Alert> alerts, boolean labels) {
        Map<String, String> common = new HashMap<>(labels ? alerts.get(0).getLabels() : alerts.get(0).getAnnotations());
        for (Alert a : alerts.subList(1, alerts.size())) {
            Map<String, String> kv = labels ? a.getLabels() : a.getAnnotations();
            for (String k : new ArrayList<>(common.keySet())) {
                if (!common.get(k).equals(kv.get(k))) {
                    common.remove(k);
                }
            }
        }
        return common;
    }
}
