package com.fastalert.model.template;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 模板可见的有序键值对 (标签 / 注解)
 */
public class KeyValues extends TreeMap<String, String> {

    private static final long serialVersionUID = 1L;

    public KeyValues() {
    }

    public KeyValues(Map<String, String> source) {
        super(source);
    }

    public List<String> names() {
        return new ArrayList<>(keySet());
    }

    public String joinValues(String separator) {
        return String.join(separator, values());
    }

    /**
     * k=v 形式, 按 key 排序
     */
    public String joinPairs(String separator) {
        List<String> pairs = new ArrayList<>(size());
        forEach((k, v) -> pairs.add(k + "=" + v));
        return String.join(separator, pairs);
    }

    public KeyValues without(Collection<String> names) {
        KeyValues copy = new KeyValues(this);
        names.forEach(copy::remove);
        return copy;
    }

    /**
     * 去掉 __x__ 形式的私有键
     */
    public static KeyValues withoutPrivate(Map<String, String> source) {
        KeyValues kv = new KeyValues();
        source.forEach((k, v) -> {
            if (!isPrivate(k)) {
                kv.put(k, v);
            }
        });
        return kv;
    }

    public static boolean isPrivate(String key) {
        return key.length() >= 4 && key.startsWith("__") && key.endsWith("__");
    }
}
