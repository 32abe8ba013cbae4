package com.lyshra.open.desk.core.engine.expression;

/**
 * Evaluates field conditions. Never throws: an expression that cannot be evaluated counts as satisfied.
 */
public interface ILyshraOpenDeskExpressionEvaluator {
    boolean evaluate(Object expression, ExpressionContext context);
}
