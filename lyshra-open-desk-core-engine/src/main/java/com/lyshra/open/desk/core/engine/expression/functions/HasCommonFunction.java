package com.lyshra.open.desk.core.engine.expression.functions;

import com.lyshra.open.desk.core.util.CastUtil;

import java.util.List;

public class HasCommonFunction implements IExpressionFunction {

    @Override
    public String getFunctionName() {
        return "has_common";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "has_common(['Sales User', 'Sales Manager'], doc.roles)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 2) {
            throw new InvalidExpressionFunctionInputException("Function requires two lists", this, arguments);
        }
    }

    @Override
    public Object execute(List<Object> arguments) {
        if (!(arguments.get(0) instanceof List<?> first) || !(arguments.get(1) instanceof List<?> second)) {
            return false;
        }
        return first.stream()
                .anyMatch(item -> second.stream().anyMatch(other -> CastUtil.strictEquals(item, other)));
    }

}
