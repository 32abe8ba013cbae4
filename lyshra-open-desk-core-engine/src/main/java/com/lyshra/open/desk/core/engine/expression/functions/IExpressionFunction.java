package com.lyshra.open.desk.core.engine.expression.functions;

import java.util.List;

public interface IExpressionFunction {
    String getFunctionName();
    List<String> getSampleUsage();

    void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException;
    Object execute(List<Object> arguments);
}
