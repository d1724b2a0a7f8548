package com.fastalert.core.template;

import com.fastalert.core.spi.PayloadSerializer;
import com.fastalert.exception.TemplateRenderException;
import com.fastalert.model.AlertGroup;
import com.fastalert.model.ctx.NotifyContext;
import com.fastalert.model.template.ExtendedData;
import org.springframework.context.expression.MapAccessor;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionException;
import org.springframework.expression.ParserContext;
import org.springframework.expression.common.TemplateParserContext;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.DataBindingMethodResolver;
import org.springframework.expression.spel.support.DataBindingPropertyAccessor;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 模板渲染器
 * 模板按 {{ }} 分隔的 SpEL 表达式求值, 只读上下文, 不允许类型引用
 */
public class TemplateRenderer {

    static final int MAX_DEPTH = 32;

    private static final ParserContext DELIMITERS = new TemplateParserContext("{{", "}}");

    private final SpelExpressionParser parser = new SpelExpressionParser();

    // 模板来自配置, 数量有限
    private final Map<String, Expression> parsed = new ConcurrentHashMap<>();

    private final NamedTemplates templates;

    private final ExtendedDataBuilder dataBuilder;

    private final String externalUrl;

    public TemplateRenderer(NamedTemplates templates, PayloadSerializer serializer, String externalUrl) {
        this.templates = templates;
        this.dataBuilder = new ExtendedDataBuilder(serializer);
        this.externalUrl = externalUrl == null ? "" : externalUrl;
    }

    /**
     * 每次通知构建一次, 渲染错误收集在返回的 expander 中
     */
    public TemplateExpander newExpander(NotifyContext ctx, AlertGroup group) {
        ExtendedData data = dataBuilder.build(ctx.getReceiverName(), group, ctx.getGroupLabels(), externalUrl);
        return new TemplateExpander(this, data);
    }

    public String getExternalUrl() {
        return externalUrl;
    }

    NamedTemplates templates() {
        return templates;
    }

    String render(String text, ExtendedData data, int depth) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        try {
            Expression expr = parsed.computeIfAbsent(text, t -> parser.parseExpression(t, DELIMITERS));
            String value = expr.getValue(context(data, depth), String.class);
            return value == null ? "" : value;
        } catch (TemplateRenderException e) {
            throw e;
        } catch (ExpressionException e) {
            throw new TemplateRenderException(e.getMessage(), e);
        } catch (RuntimeException e) {
            // 模型方法内部异常同样视为模板错误
            throw new TemplateRenderException("template evaluation failed: " + e, e);
        }
    }

    private EvaluationContext context(ExtendedData data, int depth) {
        return SimpleEvaluationContext
                .forPropertyAccessors(new MapAccessor(), DataBindingPropertyAccessor.forReadOnlyAccess())
                .withMethodResolvers(new NamedTemplateMethodResolver(this, data, depth),
                        DataBindingMethodResolver.forInstanceMethodInvocation())
                .withRootObject(data)
                .build();
    }
}
