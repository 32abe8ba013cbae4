package com.lyshra.open.desk.core.engine.field.impl;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskFieldStatus;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskDependencyOverrides;
import com.lyshra.open.desk.integration.models.dependency.LyshraOpenDeskFieldDependencyState;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocumentShare;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermission;
import com.lyshra.open.desk.integration.models.permission.LyshraOpenDeskPermissionMatrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LyshraOpenDeskFieldStatusCompilerImplTest {

    private static final String USER = "sales@example.com";

    private final LyshraOpenDeskFieldStatusCompilerImpl compiler = new LyshraOpenDeskFieldStatusCompilerImpl();

    private static final LyshraOpenDeskFieldDefinition CUSTOMER =
            LyshraOpenDeskFieldDefinition.builder().fieldName("customer").fieldType("Link").build();

    private static LyshraOpenDeskPermissionMatrix matrix(LyshraOpenDeskPermission base) {
        return new LyshraOpenDeskPermissionMatrix(Map.of(0, base), base, false);
    }

    private static LyshraOpenDeskDocument savedDocument(int docStatus) {
        return new LyshraOpenDeskDocument().put("name", "SO-0001").put("owner", USER).put("docstatus", docStatus);
    }

    private LyshraOpenDeskFieldStatus compile(LyshraOpenDeskFieldDefinition field, LyshraOpenDeskDocument document,
                                              LyshraOpenDeskPermissionMatrix matrix, LyshraOpenDeskDocumentOverlay overlay) {
        return compiler.compile(field, document, matrix, overlay, LyshraOpenDeskDependencyOverrides.empty(), USER);
    }

    @Nested
    @DisplayName("Matrix")
    class Matrix {

        @Test
        void writableDataField_isWrite() {
            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @Test
        void readOnlyField_isRead() {
            LyshraOpenDeskFieldDefinition field = CUSTOMER.toBuilder().readOnly(true).build();

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(field, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Section Break", "Column Break", "HTML", "Button"})
        void structuralField_isNeverWrite(String fieldType) {
            LyshraOpenDeskFieldDefinition field = CUSTOMER.toBuilder().fieldType(fieldType).build();

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(field, null, matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @Test
        void writeWithoutRead_isStillWrite() {
            assertEquals(LyshraOpenDeskFieldStatus.WRITE,
                    compile(CUSTOMER, null, matrix(LyshraOpenDeskPermission.of(false, true)), null));
        }

        @Test
        void noPermission_isNone() {
            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(CUSTOMER, savedDocument(0), LyshraOpenDeskPermissionMatrix.denied(), null));
            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(CUSTOMER, savedDocument(0), null, null));
            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(null, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @Test
        void higherLevelField_usesItsOwnLevel() {
            LyshraOpenDeskFieldDefinition discount = CUSTOMER.toBuilder().fieldName("discount").permissionLevel(1).build();
            LyshraOpenDeskPermissionMatrix readAtOne = new LyshraOpenDeskPermissionMatrix(
                    Map.of(0, LyshraOpenDeskPermission.FULL, 1, LyshraOpenDeskPermission.of(true, false)),
                    LyshraOpenDeskPermission.FULL, false);

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(discount, savedDocument(0), readAtOne, null));
            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(discount, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null));
        }
    }

    @Nested
    @DisplayName("Hidden fields")
    class Hidden {

        @Test
        void staticallyHidden_isNone() {
            LyshraOpenDeskFieldDefinition field = CUSTOMER.toBuilder().hidden(true).build();

            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(field, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @Test
        void hiddenByDependency_isNone_evenForAdministrators() {
            LyshraOpenDeskDependencyOverrides overrides = new LyshraOpenDeskDependencyOverrides(Map.of(
                    "customer", LyshraOpenDeskFieldDependencyState.builder().hiddenByDependency(true).build()));
            LyshraOpenDeskPermissionMatrix admin = new LyshraOpenDeskPermissionMatrix(
                    Map.of(0, LyshraOpenDeskPermission.FULL), LyshraOpenDeskPermission.FULL, true);

            assertEquals(LyshraOpenDeskFieldStatus.NONE, compiler.compile(CUSTOMER, savedDocument(0), admin, null, overrides, USER));
        }

        @Test
        void dynamicReadOnly_overridesTheStaticFlag() {
            LyshraOpenDeskDependencyOverrides lock = new LyshraOpenDeskDependencyOverrides(Map.of(
                    "customer", LyshraOpenDeskFieldDependencyState.builder().dynamicallyReadOnly(true).build()));
            LyshraOpenDeskDependencyOverrides unlock = new LyshraOpenDeskDependencyOverrides(Map.of(
                    "customer", LyshraOpenDeskFieldDependencyState.builder().dynamicallyReadOnly(false).build()));
            LyshraOpenDeskFieldDefinition staticReadOnly = CUSTOMER.toBuilder().readOnly(true).build();

            assertEquals(LyshraOpenDeskFieldStatus.READ,
                    compiler.compile(CUSTOMER, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null, lock, USER));
            assertEquals(LyshraOpenDeskFieldStatus.WRITE,
                    compiler.compile(staticReadOnly, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), null, unlock, USER));
        }
    }

    @Nested
    @DisplayName("Document lifecycle")
    class Lifecycle {

        @Test
        void cancelledDocument_isNeverWritable() {
            LyshraOpenDeskFieldDefinition allowOnSubmit = CUSTOMER.toBuilder().allowOnSubmit(true).build();

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(allowOnSubmit, savedDocument(2), matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @Test
        void submittedDocument_keepsWriteOnlyForAllowOnSubmitFields() {
            LyshraOpenDeskFieldDefinition allowOnSubmit = CUSTOMER.toBuilder().allowOnSubmit(true).build();

            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(allowOnSubmit, savedDocument(1), matrix(LyshraOpenDeskPermission.FULL), null));
            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(CUSTOMER, savedDocument(1), matrix(LyshraOpenDeskPermission.FULL), null));
        }

        @Test
        void submittedDocument_shareAloneDoesNotUnlockAllowOnSubmit() {
            LyshraOpenDeskFieldDefinition allowOnSubmit = CUSTOMER.toBuilder().allowOnSubmit(true).build();
            LyshraOpenDeskDocumentOverlay overlay = LyshraOpenDeskDocumentOverlay.builder()
                    .shared(List.of(LyshraOpenDeskDocumentShare.builder().user(USER).read(true).write(true).build()))
                    .build();

            assertEquals(LyshraOpenDeskFieldStatus.READ,
                    compile(allowOnSubmit, savedDocument(1), LyshraOpenDeskPermissionMatrix.denied(), overlay));
        }

        @Test
        void newDocument_ignoresDocStatus() {
            LyshraOpenDeskDocument document = new LyshraOpenDeskDocument().put("__islocal", 1).put("docstatus", 1);

            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, document, matrix(LyshraOpenDeskPermission.FULL), null));
        }
    }

    @Nested
    @DisplayName("Document overlay")
    class Overlay {

        @Test
        void documentPermissions_replaceTheRoleGrants() {
            LyshraOpenDeskDocumentOverlay readOnly = LyshraOpenDeskDocumentOverlay.builder()
                    .permissions(Map.of(LyshraOpenDeskPermissionType.READ, true, LyshraOpenDeskPermissionType.WRITE, false))
                    .build();
            LyshraOpenDeskDocumentOverlay writable = LyshraOpenDeskDocumentOverlay.builder()
                    .permissions(Map.of(LyshraOpenDeskPermissionType.READ, true, LyshraOpenDeskPermissionType.WRITE, true))
                    .build();

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(CUSTOMER, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), readOnly));
            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), LyshraOpenDeskPermissionMatrix.denied(), writable));
        }

        @Test
        void emptyDocumentPermissions_fallBackToTheMatrix() {
            LyshraOpenDeskDocumentOverlay overlay = LyshraOpenDeskDocumentOverlay.builder().permissions(Map.of()).build();

            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), overlay));
        }

        @Test
        void share_onlyUpgrades() {
            LyshraOpenDeskDocumentOverlay readShare = LyshraOpenDeskDocumentOverlay.builder()
                    .shared(List.of(LyshraOpenDeskDocumentShare.builder().user(USER).read(true).build()))
                    .build();
            LyshraOpenDeskDocumentOverlay writeShare = LyshraOpenDeskDocumentOverlay.builder()
                    .shared(List.of(LyshraOpenDeskDocumentShare.builder().user(USER).read(true).write(true).build()))
                    .build();

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(CUSTOMER, savedDocument(0), LyshraOpenDeskPermissionMatrix.denied(), readShare));
            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), LyshraOpenDeskPermissionMatrix.denied(), writeShare));
            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), readShare));
        }

        @Test
        void shareForAnotherUser_isIgnored() {
            LyshraOpenDeskDocumentOverlay overlay = LyshraOpenDeskDocumentOverlay.builder()
                    .shared(List.of(LyshraOpenDeskDocumentShare.builder().user("guest@example.com").read(true).write(true).build()))
                    .build();

            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(CUSTOMER, savedDocument(0), LyshraOpenDeskPermissionMatrix.denied(), overlay));
        }

        @Test
        void overlay_neverTouchesHigherLevels() {
            LyshraOpenDeskFieldDefinition discount = CUSTOMER.toBuilder().fieldName("discount").permissionLevel(1).build();
            LyshraOpenDeskDocumentOverlay overlay = LyshraOpenDeskDocumentOverlay.builder()
                    .permissions(Map.of(LyshraOpenDeskPermissionType.READ, true, LyshraOpenDeskPermissionType.WRITE, true))
                    .build();

            assertEquals(LyshraOpenDeskFieldStatus.NONE, compile(discount, savedDocument(0), matrix(LyshraOpenDeskPermission.FULL), overlay));
        }

        @Test
        void administrator_ignoresTheOverlay() {
            LyshraOpenDeskPermissionMatrix admin = new LyshraOpenDeskPermissionMatrix(
                    Map.of(0, LyshraOpenDeskPermission.FULL), LyshraOpenDeskPermission.FULL, true);
            LyshraOpenDeskDocumentOverlay overlay = LyshraOpenDeskDocumentOverlay.builder()
                    .permissions(Map.of(LyshraOpenDeskPermissionType.READ, false))
                    .build();

            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), admin, overlay));
        }
    }

    @Nested
    @DisplayName("Owner-only rules")
    class OwnerOnly {

        private final LyshraOpenDeskPermissionMatrix ownerOnlyMatrix = new LyshraOpenDeskPermissionMatrix(
                Map.of(0, LyshraOpenDeskPermission.FULL), LyshraOpenDeskPermission.of(true, false), false);

        @Test
        void ownDocument_keepsOwnerOnlyRights() {
            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, savedDocument(0), ownerOnlyMatrix, null));
        }

        @Test
        void someoneElsesDocument_fallsBackToUnrestrictedRights() {
            LyshraOpenDeskDocument document = savedDocument(0).put("owner", "other@example.com");

            assertEquals(LyshraOpenDeskFieldStatus.READ, compile(CUSTOMER, document, ownerOnlyMatrix, null));
        }

        @Test
        void unsavedDocument_keepsOwnerOnlyRights() {
            LyshraOpenDeskDocument document = new LyshraOpenDeskDocument().put("__islocal", 1).put("owner", "other@example.com");

            assertEquals(LyshraOpenDeskFieldStatus.WRITE, compile(CUSTOMER, document, ownerOnlyMatrix, null));
        }
    }
}
