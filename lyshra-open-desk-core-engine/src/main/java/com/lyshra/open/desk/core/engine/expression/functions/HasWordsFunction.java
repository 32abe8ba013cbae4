package com.lyshra.open.desk.core.engine.expression.functions;

import com.lyshra.open.desk.core.util.CastUtil;

import java.util.List;

/**
 * True when {@code item} contains any word of {@code list}. An empty item always matches.
 */
public class HasWordsFunction implements IExpressionFunction {

    @Override
    public String getFunctionName() {
        return "has_words";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "has_words(['Urgent', 'Priority'], doc.subject)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException {
        if (arguments.size() != 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a list of words and a text", this, arguments);
        }
    }

    @Override
    public Object execute(List<Object> arguments) {
        Object item = arguments.get(1);
        if (!CastUtil.castAsBoolean(item)) {
            return true;
        }
        if (!(arguments.get(0) instanceof List<?> words)) {
            return false;
        }
        String text = CastUtil.castAsString(item);
        return words.stream()
                .anyMatch(word -> text.contains(CastUtil.castAsString(word)));
    }

}
