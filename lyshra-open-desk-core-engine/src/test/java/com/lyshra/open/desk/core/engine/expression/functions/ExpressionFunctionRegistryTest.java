package com.lyshra.open.desk.core.engine.expression.functions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionFunctionRegistryTest {

    private final ExpressionFunctionRegistry registry = ExpressionFunctionRegistry.getInstance();

    @Test
    void registersTheServerHelpers() {
        assertEquals(
                Set.of("in_list", "cint", "flt", "cstr", "is_null", "has_common", "has_words"),
                registry.getAllFunctions().keySet());
        registry.getAllFunctions().values().forEach(function -> assertFalse(function.getSampleUsage().isEmpty()));
    }

    static Stream<Arguments> calls() {
        return Stream.of(
                Arguments.of("in_list", List.of(List.of("Draft", "Open"), "Open"), true),
                Arguments.of("in_list", List.of(List.of(1.0, 2.0), 2), true),
                Arguments.of("in_list", Arrays.asList("Draft", "Draft"), false),
                Arguments.of("cint", List.of("12abc"), 12.0),
                Arguments.of("cint", Arrays.asList(null, 5), 5.0),
                Arguments.of("cint", List.of(true), 1.0),
                Arguments.of("flt", List.of("USD 1,200.50"), 1200.5),
                Arguments.of("flt", List.of(2.5, 0), 3.0),
                Arguments.of("flt", List.of("abc"), 0.0),
                Arguments.of("cstr", Arrays.asList((Object) null), ""),
                Arguments.of("cstr", List.of(4.0), "4"),
                Arguments.of("is_null", List.of("  "), true),
                Arguments.of("is_null", List.of(0), false),
                Arguments.of("has_common", List.of(List.of("a", "b"), List.of("c", "b")), true),
                Arguments.of("has_common", List.of(List.of("a"), "a"), false),
                Arguments.of("has_words", List.of(List.of("Urgent"), "This is Urgent"), true),
                Arguments.of("has_words", List.of(List.of("Urgent"), ""), true),
                Arguments.of("has_words", List.of(List.of("Urgent"), "Routine"), false)
        );
    }

    @ParameterizedTest
    @MethodSource("calls")
    void execute(String functionName, List<Object> arguments, Object expected) throws InvalidExpressionFunctionInputException {
        IExpressionFunction function = registry.getFunction(functionName);
        function.validate(arguments);
        assertEquals(expected, function.execute(arguments));
    }

    static Stream<Arguments> invalidCalls() {
        return Stream.of(
                Arguments.of("in_list", List.of(List.of())),
                Arguments.of("cint", List.of()),
                Arguments.of("flt", List.of(1, 2, 3)),
                Arguments.of("is_null", List.of(1, 2)),
                Arguments.of("has_common", List.of(List.of())),
                Arguments.of("has_words", List.of())
        );
    }

    @ParameterizedTest
    @MethodSource("invalidCalls")
    void validate_rejectsWrongArity(String functionName, List<Object> arguments) {
        IExpressionFunction function = registry.getFunction(functionName);
        InvalidExpressionFunctionInputException exception =
                assertThrows(InvalidExpressionFunctionInputException.class, () -> function.validate(arguments));
        assertTrue(exception.getMessage().contains(functionName));
    }
}
