package com.lyshra.open.desk.core.engine.expression.evaluators;

import com.lyshra.open.desk.core.engine.expression.ExpressionContext;
import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskExpressionType;

/**
 * {@code fn:} hooks call into form scripts, which the engine does not run.
 */
public class FunctionReferenceExpressionEvaluator extends AbstractExpressionEvaluator {

    @Override
    public LyshraOpenDeskExpressionType getEvaluatorType() {
        return LyshraOpenDeskExpressionType.FUNCTION_REFERENCE;
    }

    @Override
    public Object evaluate(Object expression, ExpressionContext context) throws ExpressionEvaluationException {
        throw new ExpressionEvaluationException("Script hook expressions are not supported: " + expression);
    }

}
