package com.lyshra.open.desk.core.engine.expression.parser;

public enum ExpressionTokenType {
    NUMBER,
    STRING,
    IDENTIFIER,
    OPERATOR,
    END
}
