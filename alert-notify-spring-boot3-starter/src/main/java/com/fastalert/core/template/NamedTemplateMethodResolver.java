package com.fastalert.core.template;

import com.fastalert.model.template.ExtendedData;
import org.springframework.core.convert.TypeDescriptor;
import org.springframework.expression.AccessException;
import org.springframework.expression.EvaluationContext;
import org.springframework.expression.MethodExecutor;
import org.springframework.expression.MethodResolver;
import org.springframework.expression.TypedValue;

import java.util.List;

/**
 * 解析模板中的 template('name') 调用, 对同一根对象渲染命名模板
 */
class NamedTemplateMethodResolver implements MethodResolver {

    static final String FUNCTION = "template";

    private final TemplateRenderer renderer;

    private final ExtendedData data;

    private final int depth;

    NamedTemplateMethodResolver(TemplateRenderer renderer, ExtendedData data, int depth) {
        this.renderer = renderer;
        this.data = data;
        this.depth = depth;
    }

    @Override
    public MethodExecutor resolve(EvaluationContext context, Object targetObject, String name,
                                  List<TypeDescriptor> argumentTypes) {
        if (!FUNCTION.equals(name) || targetObject != data || argumentTypes.size() != 1) {
            return null;
        }
        return new MethodExecutor() {
            @Override
            public TypedValue execute(EvaluationContext ctx, Object target, Object... arguments) throws AccessException {
                String templateName = String.valueOf(arguments[0]);
                String text = renderer.templates().get(templateName);
                if (text == null) {
                    throw new AccessException("template \"" + templateName + "\" not defined");
                }
                if (depth >= TemplateRenderer.MAX_DEPTH) {
                    throw new AccessException("template \"" + templateName + "\" exceeds max nesting depth " + TemplateRenderer.MAX_DEPTH);
                }
                return new TypedValue(renderer.render(text, data, depth + 1));
            }
        };
    }
}
