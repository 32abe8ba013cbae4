package com.lyshra.open.desk.integration.models.validation;

import lombok.Data;

/**
 * Dialog-ready rendering of a failed validation.
 */
@Data
public class LyshraOpenDeskValidationSummary {
    private final String title;
    private final String message;
}
