package com.lyshra.open.desk.core.engine.validation.impl;

import com.lyshra.open.desk.core.engine.message.LyshraOpenDeskMessageSource;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskValidationErrorType;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationSummary;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class LyshraOpenDeskValidationSummaryFormatterImplTest {

    private final LyshraOpenDeskValidationSummaryFormatterImpl formatter =
            new LyshraOpenDeskValidationSummaryFormatterImpl(new LyshraOpenDeskMessageSource());

    private static LyshraOpenDeskValidationError error(String label, String message, LyshraOpenDeskValidationErrorType type) {
        return LyshraOpenDeskValidationError.builder().fieldName(label.toLowerCase()).label(label).message(message).type(type).build();
    }

    @Test
    void missingFields_areListed() {
        LyshraOpenDeskValidationSummary summary = formatter.format(List.of(
                error("Customer", "Customer is required", LyshraOpenDeskValidationErrorType.MANDATORY),
                error("Items", "Table Items cannot be empty", LyshraOpenDeskValidationErrorType.MANDATORY)), "Sales Order");

        Assertions.assertEquals("Missing Fields", summary.getTitle());
        Assertions.assertEquals(
                "Mandatory fields required in Sales Order<br><br><ul><li>Customer</li><li>Items</li></ul>",
                summary.getMessage());
    }

    @Test
    void otherErrors_followTheMissingList() {
        LyshraOpenDeskValidationSummary summary = formatter.format(List.of(
                error("Email", "Email is not a valid email address", LyshraOpenDeskValidationErrorType.FORMAT),
                error("Customer", "Customer is required", LyshraOpenDeskValidationErrorType.MANDATORY),
                error("Code", "Code exceeds maximum length of 5 characters", LyshraOpenDeskValidationErrorType.LENGTH)), null);

        Assertions.assertEquals("Missing Fields", summary.getTitle());
        Assertions.assertEquals(
                "Mandatory fields required<br><br><ul><li>Customer</li></ul><br><br>"
                        + "Email is not a valid email address<br>Code exceeds maximum length of 5 characters",
                summary.getMessage());
    }

    @Test
    void withoutMandatoryErrors_titleIsValidationError() {
        LyshraOpenDeskValidationSummary summary = formatter.format(List.of(
                error("Email", "Email is not a valid email address", LyshraOpenDeskValidationErrorType.FORMAT)), "Contact");

        Assertions.assertEquals("Validation Error", summary.getTitle());
        Assertions.assertEquals("Email is not a valid email address", summary.getMessage());
    }

    @Test
    void noErrors_giveAnEmptyMessage() {
        Assertions.assertEquals("", formatter.format(null, "Contact").getMessage());
    }
}
