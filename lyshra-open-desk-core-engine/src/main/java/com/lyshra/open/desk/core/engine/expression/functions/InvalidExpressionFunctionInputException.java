package com.lyshra.open.desk.core.engine.expression.functions;

import java.util.List;

public class InvalidExpressionFunctionInputException extends Exception {

    public InvalidExpressionFunctionInputException(String message, IExpressionFunction function, List<Object> arguments) {
        super(
                String.format(
                        "Error Message: [%s], Invalid input for expression function %s. Arguments : %s, Sample usage : %s",
                        message,
                        function.getFunctionName(),
                        arguments,
                        function.getSampleUsage()
                )
        );
    }

}
