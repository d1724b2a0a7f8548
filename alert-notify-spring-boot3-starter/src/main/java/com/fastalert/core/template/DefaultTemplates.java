package com.fastalert.core.template;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 内置命名模板
 * 语法为 SpEL 模板表达式, 以 {{ }} 包裹, 根对象为 ExtendedData
 */
public final class DefaultTemplates {

    public static final String TITLE = "{{ template('default.title') }}";
    public static final String MESSAGE = "{{ template('default.message') }}";

    public static final String TEAMS_MESSAGE = "{{ template('teams.default.message') }}";

    public static final String JIRA_SUMMARY = "{{ template('jira.default.summary') }}";
    public static final String JIRA_DESCRIPTION = "{{ template('jira.default.description') }}";
    public static final String JIRA_PRIORITY = "{{ template('jira.default.priority') }}";

    public static final String KAFKA_DETAILS = "{{ template('kafka.default.details') }}";

    private static final Map<String, String> BUILT_IN = new LinkedHashMap<>();

    static {
        BUILT_IN.put("__subject",
                "[{{ status.toUpperCase() }}{{ status == 'firing' ? ':' + alerts.firing.size() : '' }}] "
                        + "{{ groupLabels.joinValues(' ') }} "
                        + "{{ commonLabels.size() > groupLabels.size() ? '(' + commonLabels.without(groupLabels.names()).joinValues(' ') + ')' : '' }}");
        BUILT_IN.put("default.title", "{{ template('__subject') }}");
        BUILT_IN.put("default.message",
                "{{ alerts.firing.size() > 0 ? '**Firing**\n\n' + alerts.firing.describe() : '' }}"
                        + "{{ alerts.firing.size() > 0 and alerts.resolved.size() > 0 ? '\n\n' : '' }}"
                        + "{{ alerts.resolved.size() > 0 ? '**Resolved**\n\n' + alerts.resolved.describe() : '' }}");
        BUILT_IN.put("teams.default.message", "{{ template('default.message') }}");
        BUILT_IN.put("jira.default.summary", "{{ template('__subject') }}");
        BUILT_IN.put("jira.default.description", "{{ template('default.message') }}");
        BUILT_IN.put("jira.default.priority", "{{ alerts.severityPriority() }}");
        BUILT_IN.put("kafka.default.details", "{{ template('default.message') }}");
    }

    private DefaultTemplates() {}

    public static Map<String, String> builtIn() {
        return BUILT_IN;
    }
}
