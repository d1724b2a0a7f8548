package com.fastalert.model.ctx;

import com.fastalert.model.GroupKey;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 一次通知的调用上下文
 */
public class NotifyContext {

    private final GroupKey groupKey;

    // 上游路由使用的分组标签
    private final Map<String, String> groupLabels;

    private final String receiverName;

    public NotifyContext(GroupKey groupKey, Map<String, String> groupLabels, String receiverName) {
        if (groupKey == null) {
            throw new IllegalArgumentException("group key is required");
        }
        this.groupKey = groupKey;
        this.groupLabels = groupLabels == null ? Collections.emptySortedMap() : Collections.unmodifiableSortedMap(new TreeMap<>(groupLabels));
        this.receiverName = receiverName == null ? "" : receiverName;
    }

    /**
     * 分组键直接取自分组标签
     */
    public static NotifyContext forGroupLabels(Map<String, String> groupLabels, String receiverName) {
        return new NotifyContext(GroupKey.fromLabels(groupLabels), groupLabels, receiverName);
    }

    public NotifyContext withReceiverName(String name) {
        return new NotifyContext(groupKey, groupLabels, name);
    }

    public GroupKey getGroupKey() {
        return groupKey;
    }

    public Map<String, String> getGroupLabels() {
        return groupLabels;
    }

    public String getReceiverName() {
        return receiverName;
    }
}
