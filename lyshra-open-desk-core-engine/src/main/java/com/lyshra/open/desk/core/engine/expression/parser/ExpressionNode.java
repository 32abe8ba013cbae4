package com.lyshra.open.desk.core.engine.expression.parser;

import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;

@FunctionalInterface
public interface ExpressionNode {
    Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException;
}
