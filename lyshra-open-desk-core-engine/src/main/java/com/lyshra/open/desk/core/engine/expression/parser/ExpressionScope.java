package com.lyshra.open.desk.core.engine.expression.parser;

import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.core.engine.expression.functions.ExpressionFunctionRegistry;
import com.lyshra.open.desk.core.engine.expression.functions.IExpressionFunction;
import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Map;
import java.util.Optional;

/**
 * Names visible to an expression: {@code doc}, {@code parent}, the document's own fields and the
 * registered functions.
 */
@Getter
@RequiredArgsConstructor
public class ExpressionScope {
    public static final String DOC = "doc";
    public static final String PARENT = "parent";

    private final ExpressionContext context;
    private final ExpressionFunctionRegistry functionRegistry;

    public Object resolveIdentifier(String name) throws ExpressionEvaluationException {
        if (DOC.equals(name)) {
            return context.getDocument();
        }
        if (PARENT.equals(name)) {
            return context.getParent();
        }
        Map<String, Object> document = context.getDocument();
        if (document != null && document.containsKey(name)) {
            return document.get(name);
        }
        throw new ExpressionEvaluationException(name + " is not defined");
    }

    public Optional<IExpressionFunction> getFunction(String name) {
        return Optional.ofNullable(functionRegistry.getFunction(name));
    }
}
