package com.fastalert.core.template;

import com.fastalert.exception.TemplateRenderException;
import com.fastalert.model.template.ExtendedData;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单次通知内的模板展开
 * 渲染错误不会中断通知: 失败字段返回空串, 错误累积在错误槽中, 由调用方在渲染完所有字段后检查
 * 非线程安全, 每次通知一个实例
 */
public class TemplateExpander {

    private final TemplateRenderer renderer;

    private final ExtendedData data;

    private final List<TemplateRenderException> errors = new ArrayList<>();

    TemplateExpander(TemplateRenderer renderer, ExtendedData data) {
        this.renderer = renderer;
        this.data = data;
    }

    public String expand(String template) {
        try {
            return renderer.render(template, data, 0);
        } catch (TemplateRenderException e) {
            errors.add(e);
            return "";
        }
    }

    /**
     * 主模板失败时渲染默认模板, 两者都失败返回空串
     */
    public String expandOrDefault(String template, String defaultTemplate) {
        int before = errors.size();
        String value = expand(template);
        if (errors.size() == before) {
            return value;
        }
        return expand(defaultTemplate);
    }

    /**
     * 用于 URL / token 字段: 渲染失败时退回未渲染的原始配置值
     */
    public String expandOrRaw(String template) {
        int before = errors.size();
        String value = expand(template);
        return errors.size() == before ? value : template;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public TemplateRenderException firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }

    public List<TemplateRenderException> errors() {
        return Collections.unmodifiableList(errors);
    }

    public void reset() {
        errors.clear();
    }

    /**
     * 本次通知的模板根对象, 可在渲染前补充图片等信息
     */
    public ExtendedData data() {
        return data;
    }

    public String externalUrl() {
        return renderer.getExternalUrl();
    }
}
