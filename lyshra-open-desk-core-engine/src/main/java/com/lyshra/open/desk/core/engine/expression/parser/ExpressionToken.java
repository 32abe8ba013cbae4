package com.lyshra.open.desk.core.engine.expression.parser;

public record ExpressionToken(ExpressionTokenType type, String text, int position) {

    public boolean is(ExpressionTokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isOperator(String operator) {
        return is(ExpressionTokenType.OPERATOR, operator);
    }
}
