package com.lyshra.open.desk.integration.models.commons;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

class LyshraOpenDeskValuesTest {

    static Stream<Arguments> truthiness() {
        return Stream.of(
                Arguments.of(null, false),
                Arguments.of(false, false),
                Arguments.of(true, true),
                Arguments.of(0, false),
                Arguments.of(0.0, false),
                Arguments.of(Double.NaN, false),
                Arguments.of(-1, true),
                Arguments.of("", false),
                Arguments.of("0", true),
                Arguments.of(" ", true),
                Arguments.of(List.of(), false),
                Arguments.of(List.of("a"), true),
                Arguments.of(Map.of(), true));
    }

    @ParameterizedTest
    @MethodSource("truthiness")
    void isTruthy(Object value, boolean expected) {
        Assertions.assertEquals(expected, LyshraOpenDeskValues.isTruthy(value));
    }

    static Stream<Arguments> emptiness() {
        return Stream.of(
                Arguments.of(null, true),
                Arguments.of("", true),
                Arguments.of("   ", true),
                Arguments.of(List.of(), true),
                Arguments.of(Map.of(), true),
                Arguments.of(0, false),
                Arguments.of(false, false),
                Arguments.of("x", false));
    }

    @ParameterizedTest
    @MethodSource("emptiness")
    void isEmptyValue(Object value, boolean expected) {
        Assertions.assertEquals(expected, LyshraOpenDeskValues.isEmptyValue(value));
    }

    static Stream<Arguments> integers() {
        return Stream.of(
                Arguments.of(null, 0),
                Arguments.of(true, 1),
                Arguments.of(2.9, 2),
                Arguments.of("42abc", 42),
                Arguments.of(" -7", -7),
                Arguments.of("abc", 0));
    }

    @ParameterizedTest
    @MethodSource("integers")
    void cint(Object value, int expected) {
        Assertions.assertEquals(expected, LyshraOpenDeskValues.cint(value));
    }

    @Test
    void cstr_dropsTrailingZeroOfWholeDoubles() {
        Assertions.assertEquals("3", LyshraOpenDeskValues.cstr(3.0));
        Assertions.assertEquals("3.5", LyshraOpenDeskValues.cstr(3.5));
        Assertions.assertEquals("", LyshraOpenDeskValues.cstr(null));
    }
}
