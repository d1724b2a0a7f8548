package com.fastalert.core.receiver;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 以逗号、分号或换行分隔的字符串列表
 */
public final class DelimitedList {

    private static final Pattern SEPARATORS = Pattern.compile("[,;\\n]");

    private final List<String> items;

    private DelimitedList(List<String> items) {
        this.items = Collections.unmodifiableList(items);
    }

    public static DelimitedList parse(String raw) {
        List<String> items = new ArrayList<>();
        if (raw != null) {
            for (String part : SEPARATORS.split(raw)) {
                String s = part.trim();
                if (!s.isEmpty()) {
                    items.add(s);
                }
            }
        }
        return new DelimitedList(items);
    }

    /**
     * 同时接受分隔字符串与 JSON 数组
     */
    public static DelimitedList fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return parse(null);
        }
        if (node.isArray()) {
            StringBuilder sb = new StringBuilder();
            node.forEach(n -> sb.append(n.asText()).append('\n'));
            return parse(sb.toString());
        }
        return parse(node.asText());
    }

    public List<String> items() {
        return items;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    @Override
    public String toString() {
        return String.join(",", items);
    }
}
