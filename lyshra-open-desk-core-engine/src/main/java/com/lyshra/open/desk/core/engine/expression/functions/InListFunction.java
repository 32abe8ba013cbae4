package com.lyshra.open.desk.core.engine.expression.functions;

import com.lyshra.open.desk.core.util.CastUtil;

import java.util.List;

public class InListFunction implements IExpressionFunction {

    @Override
    public String getFunctionName() {
        return "in_list";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "in_list(['Draft', 'Open'], doc.status)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a list and an item", this, arguments);
        }
    }

    @Override
    public Object execute(List<Object> arguments) {
        if (!(arguments.get(0) instanceof List<?> list)) {
            return false;
        }
        Object item = arguments.get(1);
        return list.stream().anyMatch(element -> CastUtil.strictEquals(element, item));
    }

}
