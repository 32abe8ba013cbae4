package com.lyshra.open.desk.core.engine.validation.impl;

import com.lyshra.open.desk.core.engine.AbstractEngineTest;
import com.lyshra.open.desk.core.engine.validation.ILyshraOpenDeskValidationEngine;
import com.lyshra.open.desk.integration.contract.validation.ILyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskValidationErrorType;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class LyshraOpenDeskValidationEngineImplTest extends AbstractEngineTest {

    private final ILyshraOpenDeskValidationEngine engine = facade.getValidationEngine();

    private static List<String> messages(LyshraOpenDeskValidationResult result) {
        return result.getErrors().stream().map(ILyshraOpenDeskValidationError::getMessage).toList();
    }

    @Test
    void completeOrder_isValid() {
        LyshraOpenDeskValidationResult result = engine.validate(
                salesOrderMeta(), salesOrder(), Map.of("Sales Order Item", salesOrderItemMeta()));

        assertTrue(result.isValid());
        assertTrue(result.getErrors().isEmpty());
        assertTrue(result.getFirstErrorField().isEmpty());
    }

    @Nested
    @DisplayName("Mandatory fields")
    class Mandatory {

        @Test
        void missingValues_areReportedInFieldOrder() {
            LyshraOpenDeskDocument document = salesOrder().put("customer", "  ").put("delivery_date", null);

            LyshraOpenDeskValidationResult result = engine.validate(salesOrderMeta(), document);

            assertFalse(result.isValid());
            assertEquals(List.of("Customer is required", "Delivery Date is required"), messages(result));
            assertEquals(Optional.of("customer"), result.getFirstErrorField());
            result.getErrors().forEach(error -> assertEquals(LyshraOpenDeskValidationErrorType.MANDATORY, error.getType()));
        }

        @Test
        void hiddenByDependency_isNotMandatory() {
            LyshraOpenDeskDocument document = salesOrder().put("order_type", "Maintenance").put("delivery_date", null);

            assertTrue(engine.validate(salesOrderMeta(), document).isValid());
        }

        @Test
        void readOnlyAndHiddenFields_areSkipped() {
            LyshraOpenDeskDocTypeMetadata metadata = LyshraOpenDeskDocTypeMetadata.builder()
                    .name("Note")
                    .fields(List.of(
                            dataField("title").toBuilder().required(true).readOnly(true).build(),
                            dataField("secret").toBuilder().required(true).hidden(true).build(),
                            dataField("count").toBuilder().fieldType("Int").required(true).build()))
                    .build();

            // zero is a value
            assertTrue(engine.validate(metadata, new LyshraOpenDeskDocument().put("count", 0)).isValid());
        }

        @Test
        void emptyTable_isReportedAsTable() {
            LyshraOpenDeskValidationResult result = engine.validate(salesOrderMeta(), salesOrder().put("items", List.of()));

            ILyshraOpenDeskValidationError error = result.getErrors().get(0);
            assertEquals("items", error.getFieldName());
            assertEquals("Table Items cannot be empty", error.getMessage());
            assertEquals(LyshraOpenDeskValidationErrorType.MANDATORY, error.getType());
        }

        @Test
        void promptNaming_requiresANewName() {
            LyshraOpenDeskDocTypeMetadata metadata = salesOrderMeta().toBuilder().autoname("Prompt").build();
            LyshraOpenDeskDocument unnamed = salesOrder().remove("name");

            LyshraOpenDeskValidationResult result = engine.validate(metadata, unnamed);

            assertEquals(Optional.of("__newname"), result.getFirstErrorField());
            assertEquals("Name is required", result.getErrors().get(0).getMessage());
            assertTrue(engine.validate(metadata, unnamed.put("__newname", "SO-CUSTOM")).isValid());
        }
    }

    @Nested
    @DisplayName("Formats")
    class Formats {

        @Test
        void invalidEmail_isAFormatError() {
            LyshraOpenDeskValidationResult result = engine.validate(salesOrderMeta(), salesOrder().put("contact_email", "not-an-email"));

            assertEquals(List.of("Contact Email is not a valid email address"), messages(result));
            assertEquals(LyshraOpenDeskValidationErrorType.FORMAT, result.getErrors().get(0).getType());
        }

        @Test
        void tooLongValue_isALengthError() {
            LyshraOpenDeskValidationResult result = engine.validate(salesOrderMeta(), salesOrder().put("po_no", "X".repeat(21)));

            assertEquals(List.of("Customer's Purchase Order exceeds maximum length of 20 characters"), messages(result));
            assertEquals(LyshraOpenDeskValidationErrorType.LENGTH, result.getErrors().get(0).getType());
        }

        @Test
        void everyDataFormat_isChecked() {
            LyshraOpenDeskDocTypeMetadata metadata = LyshraOpenDeskDocTypeMetadata.builder()
                    .name("Contact")
                    .fields(List.of(
                            dataField("phone").toBuilder().label("Phone").options("Phone").build(),
                            dataField("website").toBuilder().label("Website").options("URL").build(),
                            dataField("full_name").toBuilder().label("Full Name").options("Name").build(),
                            // only Data fields carry a format
                            dataField("notes").toBuilder().fieldType("Small Text").options("Email").build()))
                    .build();
            LyshraOpenDeskDocument document = new LyshraOpenDeskDocument()
                    .put("phone", "12-34")
                    .put("website", "example")
                    .put("full_name", "<script>")
                    .put("notes", "free text");

            assertEquals(List.of(
                    "Phone is not a valid phone number",
                    "Website is not a valid URL",
                    "Full Name contains invalid characters"), messages(engine.validate(metadata, document)));
        }
    }

    @Nested
    @DisplayName("Child rows")
    class ChildRows {

        @Test
        void missingRowValues_carryRowAndTable() {
            List<Object> rows = new ArrayList<>();
            rows.add(Map.of("item_code", "WIDGET", "qty", 1));
            rows.add(Map.of("qty", 0));
            LyshraOpenDeskDocument document = salesOrder().put("items", rows);

            LyshraOpenDeskValidationResult result = engine.validate(
                    salesOrderMeta(), document, Map.of("Sales Order Item", salesOrderItemMeta()));

            assertEquals(1, result.getErrors().size());
            ILyshraOpenDeskValidationError error = result.getErrors().get(0);
            assertEquals("items.1.item_code", error.getFieldName());
            assertEquals("Row 2: Item is required", error.getMessage());
            assertEquals(Optional.of(2), error.getRow());
            assertEquals(Optional.of("Items"), error.getTableName());
        }

        @Test
        void rowsOfUnknownTables_areNotChecked() {
            LyshraOpenDeskDocument document = salesOrder().put("items", List.of(Map.of("qty", 1)));

            assertTrue(engine.validate(salesOrderMeta(), document).isValid());
        }
    }

    @Test
    void cancelledOrMissingDocument_isValid() {
        LyshraOpenDeskDocument cancelled = salesOrder().put("docstatus", 2).put("customer", null);

        assertTrue(engine.validate(salesOrderMeta(), cancelled).isValid());
        assertTrue(engine.validate(salesOrderMeta(), null).isValid());
        assertTrue(engine.validate(null, salesOrder()).isValid());
    }

    @Test
    void structuralFields_areIgnored() {
        LyshraOpenDeskDocTypeMetadata metadata = LyshraOpenDeskDocTypeMetadata.builder()
                .name("Layout")
                .fields(List.of(LyshraOpenDeskFieldDefinition.builder().fieldName("sb").fieldType("Section Break").required(true).build()))
                .build();

        assertTrue(engine.validate(metadata, new LyshraOpenDeskDocument()).isValid());
    }
}
