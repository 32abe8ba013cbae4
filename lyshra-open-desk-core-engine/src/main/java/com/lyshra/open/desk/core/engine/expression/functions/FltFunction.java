package com.lyshra.open.desk.core.engine.expression.functions;

import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;

import java.util.List;

/**
 * Lenient float parsing: strips a currency prefix and {@code ,} group separators, unparsable input is 0.
 */
public class FltFunction implements IExpressionFunction {

    @Override
    public String getFunctionName() {
        return "flt";
    }

    @Override
    public List<String> getSampleUsage() {
        return List.of(
                "flt(doc.grand_total) > 0",
                "flt(doc.rate, 2)"
        );
    }

    @Override
    public void validate(List<Object> arguments) throws InvalidExpressionFunctionInputException {
        if (arguments.isEmpty() || arguments.size() > 2) {
            throw new InvalidExpressionFunctionInputException("Function requires a value and optional decimals", this, arguments);
        }
    }

    @Override
    public Object execute(List<Object> arguments) {
        double value = parse(arguments.get(0));
        Object decimals = arguments.size() > 1 ? arguments.get(1) : null;
        if (decimals == null) {
            return value;
        }
        double multiplier = Math.pow(10, LyshraOpenDeskValues.cint(decimals));
        return Math.floor(value * multiplier + 0.5) / multiplier;
    }

    static double parse(Object value) {
        if (value == null || "".equals(value)) {
            return 0;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        String text = LyshraOpenDeskValues.cstr(value).trim();
        if (text.contains(" ")) {
            String[] parts = text.split("\\s+");
            if (Double.isNaN(leadingFloat(parts[0]))) {
                text = parts[parts.length - 1];
            }
        }
        double parsed = leadingFloat(text.replace(",", ""));
        return Double.isNaN(parsed) ? 0 : parsed;
    }

    private static double leadingFloat(String text) {
        int end = 0;
        boolean digits = false;
        boolean dot = false;
        if (end < text.length() && (text.charAt(end) == '-' || text.charAt(end) == '+')) {
            end++;
        }
        while (end < text.length()) {
            char c = text.charAt(end);
            if (Character.isDigit(c)) {
                digits = true;
            } else if (c == '.' && !dot) {
                dot = true;
            } else {
                break;
            }
            end++;
        }
        if (!digits) {
            return Double.NaN;
        }
        return Double.parseDouble(text.substring(0, end));
    }

}
