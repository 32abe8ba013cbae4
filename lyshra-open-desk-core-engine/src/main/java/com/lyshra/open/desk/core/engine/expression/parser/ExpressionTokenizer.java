package com.lyshra.open.desk.core.engine.expression.parser;

import com.lyshra.open.desk.core.exception.expression.ExpressionEvaluationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits expression source into tokens. Operators are matched longest first.
 */
public class ExpressionTokenizer {

    private static final List<String> OPERATORS = List.of(
            "===", "!==",
            "==", "!=", "<=", ">=", "&&", "||",
            "<", ">", "!", "+", "-", "*", "/", "%",
            "(", ")", "[", "]", ",", ".", "?", ":"
    );

    private final String source;
    private int position;

    public ExpressionTokenizer(String source) {
        this.source = source;
    }

    public List<ExpressionToken> tokenize() throws ExpressionEvaluationException {
        List<ExpressionToken> tokens = new ArrayList<>();
        position = 0;
        while (true) {
            skipWhitespace();
            if (position >= source.length()) {
                tokens.add(new ExpressionToken(ExpressionTokenType.END, "", position));
                return tokens;
            }
            char current = source.charAt(position);
            if (Character.isDigit(current) || (current == '.' && isDigitAt(position + 1))) {
                tokens.add(readNumber());
            } else if (current == '"' || current == '\'') {
                tokens.add(readString(current));
            } else if (isIdentifierStart(current)) {
                tokens.add(readIdentifier());
            } else {
                tokens.add(readOperator());
            }
        }
    }

    private void skipWhitespace() {
        while (position < source.length() && Character.isWhitespace(source.charAt(position))) {
            position++;
        }
    }

    private boolean isDigitAt(int index) {
        return index < source.length() && Character.isDigit(source.charAt(index));
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '_' || c == '$';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || Character.isDigit(c);
    }

    private ExpressionToken readNumber() throws ExpressionEvaluationException {
        int start = position;
        while (isDigitAt(position)) {
            position++;
        }
        if (position < source.length() && source.charAt(position) == '.') {
            position++;
            while (isDigitAt(position)) {
                position++;
            }
        }
        if (position < source.length() && (source.charAt(position) == 'e' || source.charAt(position) == 'E')) {
            int exponentStart = position;
            position++;
            if (position < source.length() && (source.charAt(position) == '+' || source.charAt(position) == '-')) {
                position++;
            }
            if (!isDigitAt(position)) {
                throw new ExpressionEvaluationException("Malformed number exponent at position " + exponentStart);
            }
            while (isDigitAt(position)) {
                position++;
            }
        }
        if (position < source.length() && isIdentifierStart(source.charAt(position))) {
            throw new ExpressionEvaluationException("Unexpected character after number at position " + position);
        }
        return new ExpressionToken(ExpressionTokenType.NUMBER, source.substring(start, position), start);
    }

    private ExpressionToken readString(char quote) throws ExpressionEvaluationException {
        int start = position;
        position++;
        StringBuilder value = new StringBuilder();
        while (position < source.length()) {
            char current = source.charAt(position++);
            if (current == quote) {
                return new ExpressionToken(ExpressionTokenType.STRING, value.toString(), start);
            }
            if (current == '\\') {
                if (position >= source.length()) {
                    break;
                }
                char escaped = source.charAt(position++);
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    default -> value.append(escaped);
                }
            } else {
                value.append(current);
            }
        }
        throw new ExpressionEvaluationException("Unterminated string starting at position " + start);
    }

    private ExpressionToken readIdentifier() {
        int start = position;
        while (position < source.length() && isIdentifierPart(source.charAt(position))) {
            position++;
        }
        return new ExpressionToken(ExpressionTokenType.IDENTIFIER, source.substring(start, position), start);
    }

    private ExpressionToken readOperator() throws ExpressionEvaluationException {
        for (String operator : OPERATORS) {
            if (source.startsWith(operator, position)) {
                ExpressionToken token = new ExpressionToken(ExpressionTokenType.OPERATOR, operator, position);
                position += operator.length();
                return token;
            }
        }
        throw new ExpressionEvaluationException(
                "Unexpected character '" + source.charAt(position) + "' at position " + position);
    }
}
