package com.lyshra.open.desk.core.engine.expression.evaluators;

import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;

/**
 * Reads the named field of the document; the condition holds when the value is truthy
 * (lists must be non-empty).
 */
public class FieldReferenceExpressionEvaluator extends AbstractExpressionEvaluator {

    @Override
    public LyshraOpenDeskExpressionType getEvaluatorType() {
        return LyshraOpenDeskExpressionType.FIELD_REFERENCE;
    }

    @Override
    public Object evaluate(Object expression, ExpressionContext context) {
        return context.getDocument().get(String.valueOf(expression));
    }

}
