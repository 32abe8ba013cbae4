package com.lyshra.open.desk.integration.models.permission;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class LyshraOpenDeskPermissionTest {

    private static final List<LyshraOpenDeskPermission> ALL = List.of(
            LyshraOpenDeskPermission.NONE,
            LyshraOpenDeskPermission.of(true, false),
            LyshraOpenDeskPermission.of(false, true),
            LyshraOpenDeskPermission.FULL);

    static Stream<Arguments> pairs() {
        return ALL.stream().flatMap(a -> ALL.stream().map(b -> Arguments.of(a, b)));
    }

    static Stream<Arguments> triples() {
        return ALL.stream().flatMap(a -> ALL.stream().flatMap(b -> ALL.stream().map(c -> Arguments.of(a, b, c))));
    }

    @Nested
    @DisplayName("Merge")
    class Merge {

        @ParameterizedTest
        @MethodSource("com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionTest#pairs")
        void merge_isCommutative(LyshraOpenDeskPermission a, LyshraOpenDeskPermission b) {
            assertEquals(a.merge(b), b.merge(a));
        }

        @ParameterizedTest
        @MethodSource("com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionTest#triples")
        void merge_isAssociative(LyshraOpenDeskPermission a, LyshraOpenDeskPermission b, LyshraOpenDeskPermission c) {
            assertEquals(a.merge(b).merge(c), a.merge(b.merge(c)));
        }

        @ParameterizedTest
        @MethodSource("com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionTest#pairs")
        void merge_neverDropsAGrant(LyshraOpenDeskPermission a, LyshraOpenDeskPermission b) {
            LyshraOpenDeskPermission merged = a.merge(b);
            assertEquals(a.isRead() || b.isRead(), merged.isRead());
            assertEquals(a.isWrite() || b.isWrite(), merged.isWrite());
        }

        @Test
        void none_isIdentity() {
            for (LyshraOpenDeskPermission permission : ALL) {
                assertEquals(permission, permission.merge(LyshraOpenDeskPermission.NONE));
                assertEquals(permission, LyshraOpenDeskPermission.merge(null, permission));
            }
        }

        @Test
        void mergeOfTwoNulls_isNone() {
            assertEquals(LyshraOpenDeskPermission.NONE, LyshraOpenDeskPermission.merge(null, null));
        }
    }

    @Nested
    @DisplayName("Matrix")
    class Matrix {

        @Test
        void levelZero_isAlwaysPresent() {
            LyshraOpenDeskPermissionMatrix matrix = new LyshraOpenDeskPermissionMatrix(
                    Map.of(1, LyshraOpenDeskPermission.FULL), null, false);

            assertTrue(matrix.getPermission(0).isPresent());
            assertEquals(LyshraOpenDeskPermission.NONE, matrix.getBaseLevel());
            assertEquals(LyshraOpenDeskPermission.NONE, matrix.getUnrestrictedBaseLevel());
        }

        @Test
        void missingLevel_isEmptyButReadsAsNone() {
            LyshraOpenDeskPermissionMatrix matrix = LyshraOpenDeskPermissionMatrix.denied();

            assertTrue(matrix.getPermission(3).isEmpty());
            assertEquals(LyshraOpenDeskPermission.NONE, matrix.getPermissionOrNone(3));
            assertFalse(matrix.isAdministrator());
        }

        @Test
        void levels_areSortedAndUnmodifiable() {
            LyshraOpenDeskPermissionMatrix matrix = new LyshraOpenDeskPermissionMatrix(
                    Map.of(2, LyshraOpenDeskPermission.FULL, 0, LyshraOpenDeskPermission.FULL),
                    LyshraOpenDeskPermission.FULL, false);

            assertEquals(List.of(0, 2), List.copyOf(matrix.getLevels().keySet()));
            assertThrows(UnsupportedOperationException.class,
                    () -> matrix.getLevels().put(5, LyshraOpenDeskPermission.NONE));
        }
    }
}
