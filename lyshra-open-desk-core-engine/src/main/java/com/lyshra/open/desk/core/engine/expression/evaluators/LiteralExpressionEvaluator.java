package com.lyshra.open.desk.core.engine.expression.evaluators;

import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;

/**
 * No condition is satisfied; a boolean stands for itself.
 */
public class LiteralExpressionEvaluator extends AbstractExpressionEvaluator {

    @Override
    public LyshraOpenDeskExpressionType getEvaluatorType() {
        return LyshraOpenDeskExpressionType.LITERAL;
    }

    @Override
    public Object evaluate(Object expression, ExpressionContext context) {
        return expression == null ? Boolean.TRUE : expression;
    }

}
