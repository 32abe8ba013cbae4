package com.lyshra.open.desk.core.engine.expression.functions;

import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;

import java.util.List;

public class CintFunction implements IExpressionFunction {

    @Override
    public String getFunctionName() {
        return "cint";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "cint(doc.is_group)",
                "cint(doc.qty, 1)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException {
        if (arguments.isEmpty() || arguments.size() > 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a value and an optional default", this, arguments);
        }
    }

    @Override
    public Object execute(List<Object> arguments) {
        int defaultValue = arguments.size() > 1 ? LyshraOpenDeskValues.cint(arguments.get(1)) : 0;
        return (double) LyshraOpenDeskValues.cint(arguments.get(0), defaultValue);
    }

}
