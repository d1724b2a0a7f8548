package com.fastalert.model.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.stream.Collectors;

/**
 * 告警列表, 额外提供按状态筛选
 */
public class ExtendedAlerts extends ArrayList<ExtendedAlert> {

    private static final long serialVersionUID = 1L;

    public ExtendedAlerts() {
    }

    public ExtendedAlerts(Collection<ExtendedAlert> alerts) {
        super(alerts);
    }

    public ExtendedAlerts getFiring() {
        return stream().filter(ExtendedAlert::isFiring).collect(Collectors.toCollection(ExtendedAlerts::new));
    }

    public ExtendedAlerts getResolved() {
        return stream().filter(a -> !a.isFiring()).collect(Collectors.toCollection(ExtendedAlerts::new));
    }

    public String describe() {
        return stream().map(ExtendedAlert::describe).collect(Collectors.joining("\n"));
    }

    /**
     * severity 标签映射到工单优先级, 触发中的告警优先
     * critical -> High, warning -> Medium, info -> Low
     */
    public String severityPriority() {
        String priority = priorityOf(getFiring());
        return priority.isEmpty() ? priorityOf(getResolved()) : priority;
    }

    private static String priorityOf(ExtendedAlerts alerts) {
        String priority = "";
        for (ExtendedAlert a : alerts) {
            String severity = a.getLabels().getOrDefault("severity", "");
            if ("critical".equals(severity)) {
                priority = "High";
            } else if ("warning".equals(severity) && !"High".equals(priority)) {
                priority = "Medium";
            } else if ("info".equals(severity) && priority.isEmpty()) {
                priority = "Low";
            }
        }
        return priority;
    }
}
