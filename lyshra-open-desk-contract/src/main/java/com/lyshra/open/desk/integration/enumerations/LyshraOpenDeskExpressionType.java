package com.lyshra.open.desk.integration.enumerations;

/**
 * Shapes a field condition can take in document type metadata.
 */
public enum LyshraOpenDeskExpressionType {
    /**
     * {@code null} or a boolean literal.
     */
    LITERAL,
    /**
     * A bare field name, satisfied when the field holds a truthy value.
     */
    FIELD_REFERENCE,
    /**
     * An {@code eval:} expression.
     */
    EVAL,
    /**
     * An {@code fn:} script hook.
     */
    FUNCTION_REFERENCE
}
