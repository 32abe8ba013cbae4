package com.lyshra.open.desk.core.exception.expression;

import com.lyshra.open.desk.core.exception.LyshraOpenDeskException;

/**
 * An {@code eval:} expression could not be tokenized, parsed or evaluated.
 */
public class ExpressionEvaluationException extends LyshraOpenDeskException {
    public ExpressionEvaluationException(String message) {
        super(message);
    }
    public ExpressionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
