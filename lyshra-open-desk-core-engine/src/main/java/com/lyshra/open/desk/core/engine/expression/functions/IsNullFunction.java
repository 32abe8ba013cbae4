package com.lyshra.open.desk.core.engine.expression.functions;

import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;

import java.util.List;

public class IsNullFunction implements IExpressionFunction {

    @Override
    public String getFunctionName() {
        return "is_null";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "is_null(doc.customer)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 1) {
            throw new InvalidExpressionFunctionInputException("Function requires a single value", this, arguments);
        }
    }

    @Override
    public Object execute(List<Object> arguments) {
        return LyshraOpenDeskValues.cstr(arguments.get(0)).trim().isEmpty();
    }

}
