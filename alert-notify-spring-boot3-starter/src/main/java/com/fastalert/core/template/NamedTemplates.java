package com.fastalert.core.template;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 命名模板注册表, 用户模板可覆盖内置模板
 */
public class NamedTemplates {

    private final Map<String, String> templates;

    public NamedTemplates(Map<String, String> userTemplates) {
        Map<String, String> all = new LinkedHashMap<>(DefaultTemplates.builtIn());
        if (userTemplates != null) {
            all.putAll(userTemplates);
        }
        this.templates = Collections.unmodifiableMap(all);
    }

    public static NamedTemplates defaults() {
        return new NamedTemplates(null);
    }

    public String get(String name) {
        return templates.get(name);
    }

    public Set<String> names() {
        return templates.keySet();
    }
}
