package com.fastalert.core.notify.notifier.jira;

import lombok.Data;

import java.util.List;

/**
 * JIRA 查询与流转接口的响应, 只映射用到的字段
 */
@Data
public class JiraIssue {

    private String key;

    private Fields fields;

    /**
     * 状态分类 key, 可能为空
     */
    public String statusCategory() {
        if (fields == null || fields.getStatus() == null || fields.getStatus().getStatusCategory() == null) {
            return null;
        }
        return fields.getStatus().getStatusCategory().getKey();
    }

    @Data
    public static class Fields {
        private Status status;
    }

    @Data
    public static class Status {
        private KeyValue statusCategory;
    }

    @Data
    public static class KeyValue {
        private String key;
    }

    @Data
    public static class SearchResult {
        private int total;
        private List<JiraIssue> issues;
    }

    @Data
    public static class Transitions {
        private List<Transition> transitions;
    }

    @Data
    public static class Transition {
        private String id;
        private String name;
    }
}
