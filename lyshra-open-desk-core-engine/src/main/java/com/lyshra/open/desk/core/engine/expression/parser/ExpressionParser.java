package com.lyshra.open.desk.core.engine.expression.parser;

import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for {@code eval:} expressions.
 *
 * <pre>
 * conditional    := or ( '?' conditional ':' conditional )?
 * or             := and ( '||' and )*
 * and            := equality ( '&amp;&amp;' equality )*
 * equality       := relational ( ( '==' | '!=' | '===' | '!==' ) relational )*
 * relational     := additive ( ( '&lt;' | '&lt;=' | '&gt;' | '&gt;=' ) additive )*
 * additive       := multiplicative ( ( '+' | '-' ) multiplicative )*
 * multiplicative := unary ( ( '*' | '/' | '%' ) unary )*
 * unary          := ( '!' | '-' | '+' ) unary | postfix
 * postfix        := primary ( '.' identifier | '[' conditional ']' | '(' arguments ')' )*
 * primary        := number | string | identifier | '(' conditional ')' | '[' elements ']'
 * </pre>
 *
 * Nesting is bounded by {@code maxDepth}; the parser rejects deeper input instead of recursing.
 */
public class ExpressionParser {

    private static final Set<String> EQUALITY_OPERATORS = Set.of("==", "!=", "===", "!==");
    private static final Set<String> RELATIONAL_OPERATORS = Set.of("<", "<=", ">", ">=");
    private static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");
    private static final Set<String> UNARY_OPERATORS = Set.of("!", "-", "+");

    private final List<ExpressionToken> tokens;
    private final int maxDepth;
    private int position;
    private int depth;

    public ExpressionParser(List<ExpressionToken> tokens, int maxDepth) {
        this.tokens = tokens;
        this.maxDepth = maxDepth;
    }

    public static ExpressionNode parse(String source, int maxDepth) throws ExpressionEvaluationException {
        return new ExpressionParser(new ExpressionTokenizer(source).tokenize(), maxDepth).parse();
    }

    public ExpressionNode parse() throws ExpressionEvaluationException {
        if (peek().type() == ExpressionTokenType.END) {
            throw new ExpressionEvaluationException("Empty expression");
        }
        ExpressionNode node = parseConditional();
        ExpressionToken trailing = peek();
        if (trailing.type() != ExpressionTokenType.END) {
            throw unexpected(trailing);
        }
        return node;
    }

    private ExpressionNode parseConditional() throws ExpressionEvaluationException {
        enter();
        try {
            ExpressionNode test = parseOr();
            if (!match("?")) {
                return test;
            }
            ExpressionNode whenTrue = parseConditional();
            expect(":");
            ExpressionNode whenFalse = parseConditional();
            return new ExpressionNodes.Conditional(test, whenTrue, whenFalse);
        } finally {
            depth--;
        }
    }

    private ExpressionNode parseOr() throws ExpressionEvaluationException {
        ExpressionNode node = parseAnd();
        while (match("||")) {
            node = new ExpressionNodes.Logical("||", node, parseAnd());
        }
        return node;
    }

    private ExpressionNode parseAnd() throws ExpressionEvaluationException {
        ExpressionNode node = parseEquality();
        while (match("&&")) {
            node = new ExpressionNodes.Logical("&&", node, parseEquality());
        }
        return node;
    }

    private ExpressionNode parseEquality() throws ExpressionEvaluationException {
        ExpressionNode node = parseRelational();
        while (EQUALITY_OPERATORS.contains(operatorText())) {
            String operator = next().text();
            node = new ExpressionNodes.Binary(operator, node, parseRelational());
        }
        return node;
    }

    private ExpressionNode parseRelational() throws ExpressionEvaluationException {
        ExpressionNode node = parseAdditive();
        while (RELATIONAL_OPERATORS.contains(operatorText())) {
            String operator = next().text();
            node = new ExpressionNodes.Binary(operator, node, parseAdditive());
        }
        return node;
    }

    private ExpressionNode parseAdditive() throws ExpressionEvaluationException {
        ExpressionNode node = parseMultiplicative();
        while (ADDITIVE_OPERATORS.contains(operatorText())) {
            String operator = next().text();
            node = new ExpressionNodes.Binary(operator, node, parseMultiplicative());
        }
        return node;
    }

    private ExpressionNode parseMultiplicative() throws ExpressionEvaluationException {
        ExpressionNode node = parseUnary();
        while (MULTIPLICATIVE_OPERATORS.contains(operatorText())) {
            String operator = next().text();
            node = new ExpressionNodes.Binary(operator, node, parseUnary());
        }
        return node;
    }

    private ExpressionNode parseUnary() throws ExpressionEvaluationException {
        if (UNARY_OPERATORS.contains(operatorText())) {
            enter();
            try {
                String operator = next().text();
                return new ExpressionNodes.Unary(operator, parseUnary());
            } finally {
                depth--;
            }
        }
        return parsePostfix();
    }

    private ExpressionNode parsePostfix() throws ExpressionEvaluationException {
        ExpressionNode node = parsePrimary();
        while (true) {
            if (match(".")) {
                ExpressionToken name = next();
                if (name.type() != ExpressionTokenType.IDENTIFIER) {
                    throw unexpected(name);
                }
                if (peek().isOperator("(")) {
                    next();
                    node = new ExpressionNodes.MethodCall(node, name.text(), parseArguments(")"));
                } else {
                    node = new ExpressionNodes.Member(node, new ExpressionNodes.Literal(name.text()));
                }
            } else if (match("[")) {
                ExpressionNode key = parseConditional();
                expect("]");
                node = new ExpressionNodes.Member(node, key);
            } else if (peek().isOperator("(")) {
                ExpressionToken open = next();
                if (!(node instanceof ExpressionNodes.Identifier identifier)) {
                    throw new ExpressionEvaluationException("Expression is not callable at position " + open.position());
                }
                node = new ExpressionNodes.FunctionCall(identifier.name(), parseArguments(")"));
            } else {
                return node;
            }
        }
    }

    private ExpressionNode parsePrimary() throws ExpressionEvaluationException {
        ExpressionToken token = next();
        switch (token.type()) {
            case NUMBER:
                try {
                    return new ExpressionNodes.Literal(Double.parseDouble(token.text()));
                } catch (NumberFormatException e) {
                    throw new ExpressionEvaluationException("Malformed number " + token.text(), e);
                }
            case STRING:
                return new ExpressionNodes.Literal(token.text());
            case IDENTIFIER:
                return switch (token.text()) {
                    case "true" -> new ExpressionNodes.Literal(Boolean.TRUE);
                    case "false" -> new ExpressionNodes.Literal(Boolean.FALSE);
                    case "null", "undefined" -> new ExpressionNodes.Literal(null);
                    default -> new ExpressionNodes.Identifier(token.text());
                };
            case OPERATOR:
                if (token.isOperator("(")) {
                    ExpressionNode inner = parseConditional();
                    expect(")");
                    return inner;
                }
                if (token.isOperator("[")) {
                    return new ExpressionNodes.ArrayLiteral(parseArguments("]"));
                }
                throw unexpected(token);
            default:
                throw unexpected(token);
        }
    }

    private List<ExpressionNode> parseArguments(String closing) throws ExpressionEvaluationException {
        List<ExpressionNode> arguments = new ArrayList<>();
        if (match(closing)) {
            return arguments;
        }
        do {
            arguments.add(parseConditional());
        } while (match(","));
        expect(closing);
        return arguments;
    }

    private void enter() throws ExpressionEvaluationException {
        if (++depth > maxDepth) {
            throw new ExpressionEvaluationException("Expression nesting exceeds " + maxDepth + " levels");
        }
    }

    private ExpressionToken peek() {
        return tokens.get(position);
    }

    private ExpressionToken next() {
        ExpressionToken token = tokens.get(position);
        if (token.type() != ExpressionTokenType.END) {
            position++;
        }
        return token;
    }

    private String operatorText() {
        ExpressionToken token = peek();
        return token.type() == ExpressionTokenType.OPERATOR ? token.text() : "";
    }

    private boolean match(String operator) {
        if (peek().isOperator(operator)) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(String operator) throws ExpressionEvaluationException {
        ExpressionToken token = next();
        if (!token.isOperator(operator)) {
            throw new ExpressionEvaluationException(
                    "Expected '" + operator + "' but found '" + token.text() + "' at position " + token.position());
        }
    }

    private static ExpressionEvaluationException unexpected(ExpressionToken token) {
        if (token.type() == ExpressionTokenType.END) {
            return new ExpressionEvaluationException("Unexpected end of expression");
        }
        return new ExpressionEvaluationException("Unexpected token '" + token.text() + "' at position " + token.position());
    }
}
