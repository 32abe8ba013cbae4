package com.lyshra.open.desk.core.engine.expression.parser;

import com.lyshra.open.desk.core.engine.expression.functions.IExpressionFunction;
import com.lyshra.open.desk.core.engine.expression.functions.InvalidExpressionFunctionInputException;
import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;
import com.lyshra.open.desk.core.util.CastUtil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Syntax tree nodes produced by {@link ExpressionParser}.
 */
public final class ExpressionNodes {

    private ExpressionNodes() {}

    public record Literal(Object value) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) {
            return value;
        }
    }

    public record ArrayLiteral(List<ExpressionNode> elements) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            return Collections.unmodifiableList(evaluateAll(elements, scope));
        }
    }

    public record Identifier(String name) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            return scope.resolveIdentifier(name);
        }
    }

    public record Member(ExpressionNode target, ExpressionNode key) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            return readMember(target.evaluate(scope), key.evaluate(scope));
        }
    }

    public record FunctionCall(String name, List<ExpressionNode> arguments) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            IExpressionFunction function = scope.getFunction(name)
                    .orElseThrow(() -> new ExpressionEvaluationException(name + " is not a function"));
            List<Object> values = evaluateAll(arguments, scope);
            try {
                function.validate(values);
            } catch (InvalidExpressionFunctionInputException e) {
                throw new ExpressionEvaluationException(e.getMessage(), e);
            }
            return function.execute(values);
        }
    }

    public record MethodCall(ExpressionNode target, String method, List<ExpressionNode> arguments) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            Object receiver = target.evaluate(scope);
            if (receiver == null) {
                throw new ExpressionEvaluationException("Cannot read property '" + method + "' of null");
            }
            return invokeMethod(receiver, method, evaluateAll(arguments, scope));
        }
    }

    public record Unary(String operator, ExpressionNode operand) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            Object value = operand.evaluate(scope);
            return switch (operator) {
                case "!" -> !CastUtil.castAsBoolean(value);
                case "-" -> -CastUtil.castAsNumber(value);
                case "+" -> CastUtil.castAsNumber(value);
                default -> throw new ExpressionEvaluationException("Unsupported unary operator " + operator);
            };
        }
    }

    public record Logical(String operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            Object leftValue = left.evaluate(scope);
            boolean leftTruthy = CastUtil.castAsBoolean(leftValue);
            if ("&&".equals(operator)) {
                return leftTruthy ? right.evaluate(scope) : leftValue;
            }
            return leftTruthy ? leftValue : right.evaluate(scope);
        }
    }

    public record Conditional(ExpressionNode test, ExpressionNode whenTrue, ExpressionNode whenFalse) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            return CastUtil.castAsBoolean(test.evaluate(scope)) ? whenTrue.evaluate(scope) : whenFalse.evaluate(scope);
        }
    }

    public record Binary(String operator, ExpressionNode left, ExpressionNode right) implements ExpressionNode {
        @Override
        public Object evaluate(ExpressionScope scope) throws ExpressionEvaluationException {
            Object l = left.evaluate(scope);
            Object r = right.evaluate(scope);
            return switch (operator) {
                case "+" -> add(l, r);
                case "-" -> CastUtil.castAsNumber(l) - CastUtil.castAsNumber(r);
                case "*" -> CastUtil.castAsNumber(l) * CastUtil.castAsNumber(r);
                case "/" -> CastUtil.castAsNumber(l) / CastUtil.castAsNumber(r);
                case "%" -> CastUtil.castAsNumber(l) % CastUtil.castAsNumber(r);
                case "==" -> CastUtil.looseEquals(l, r);
                case "!=" -> !CastUtil.looseEquals(l, r);
                case "===" -> CastUtil.strictEquals(l, r);
                case "!==" -> !CastUtil.strictEquals(l, r);
                case "<", "<=", ">", ">=" -> relational(operator, l, r);
                default -> throw new ExpressionEvaluationException("Unsupported operator " + operator);
            };
        }
    }

    private static List<Object> evaluateAll(List<ExpressionNode> nodes, ExpressionScope scope) throws ExpressionEvaluationException {
        List<Object> values = new ArrayList<>(nodes.size());
        for (ExpressionNode node : nodes) {
            values.add(node.evaluate(scope));
        }
        return values;
    }

    private static Object add(Object l, Object r) {
        if (!CastUtil.isPrimitive(l) || !CastUtil.isPrimitive(r) || l instanceof String || r instanceof String) {
            return CastUtil.castAsString(l) + CastUtil.castAsString(r);
        }
        return CastUtil.castAsNumber(l) + CastUtil.castAsNumber(r);
    }

    private static boolean relational(String operator, Object l, Object r) {
        Integer comparison = CastUtil.compare(l, r);
        if (comparison == null) {
            return false;
        }
        return switch (operator) {
            case "<" -> comparison < 0;
            case "<=" -> comparison <= 0;
            case ">" -> comparison > 0;
            default -> comparison >= 0;
        };
    }

    static Object readMember(Object target, Object key) throws ExpressionEvaluationException {
        if (target == null) {
            throw new ExpressionEvaluationException("Cannot read property '" + CastUtil.castAsString(key) + "' of null");
        }
        if (target instanceof Map<?, ?> map) {
            return map.get(CastUtil.castAsString(key));
        }
        if (target instanceof List<?> list) {
            if ("length".equals(key)) {
                return (double) list.size();
            }
            int index = toIndex(key);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        if (target instanceof String string) {
            if ("length".equals(key)) {
                return (double) string.length();
            }
            int index = toIndex(key);
            return index >= 0 && index < string.length() ? String.valueOf(string.charAt(index)) : null;
        }
        return null;
    }

    private static int toIndex(Object key) {
        double d = CastUtil.castAsNumber(key);
        return d == Math.rint(d) && !Double.isInfinite(d) ? (int) d : -1;
    }

    private static Object invokeMethod(Object receiver, String method, List<Object> arguments) throws ExpressionEvaluationException {
        Object first = arguments.isEmpty() ? null : arguments.get(0);
        if (receiver instanceof String string) {
            return switch (method) {
                case "includes" -> string.contains(CastUtil.castAsString(first));
                case "indexOf" -> (double) string.indexOf(CastUtil.castAsString(first));
                case "startsWith" -> string.startsWith(CastUtil.castAsString(first));
                case "endsWith" -> string.endsWith(CastUtil.castAsString(first));
                case "trim" -> string.trim();
                case "toLowerCase" -> string.toLowerCase(Locale.ROOT);
                case "toUpperCase" -> string.toUpperCase(Locale.ROOT);
                default -> throw new ExpressionEvaluationException("string." + method + " is not a function");
            };
        }
        if (receiver instanceof List<?> list) {
            switch (method) {
                case "includes":
                    return indexOf(list, first) >= 0;
                case "indexOf":
                    return (double) indexOf(list, first);
                default:
                    throw new ExpressionEvaluationException("list." + method + " is not a function");
            }
        }
        throw new ExpressionEvaluationException(method + " is not a function");
    }

    private static int indexOf(List<?> list, Object item) {
        for (int i = 0; i < list.size(); i++) {
            if (CastUtil.strictEquals(list.get(i), item)) {
                return i;
            }
        }
        return -1;
    }
}
