package com.lyshra.open.desk.core.engine.expression.evaluators;

import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;
import com.lyshra.open.desk.core.util.CastUtil;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;

public abstract class AbstractExpressionEvaluator {

    public abstract LyshraOpenDeskExpressionType getEvaluatorType();

    public abstract Object evaluate(Object expression, ExpressionContext context) throws ExpressionEvaluationException;

    public boolean evaluateBoolean(Object expression, ExpressionContext context) throws ExpressionEvaluationException {
        return CastUtil.castAsBoolean(evaluate(expression, context));
    }

}
