package com.lyshra.open.desk.core.engine.validation;

import com.lyshra.open.desk.integration.contract.validation.ILyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.models.validation.LyshraOpenDeskValidationSummary;

import java.util.List;

public interface ILyshraOpenDeskValidationSummaryFormatter {

    /**
     * @param documentType named in the mandatory fields heading when not {@code null}
     */
    LyshraOpenDeskValidationSummary format(List<? extends ILyshraOpenDeskValidationError> errors, String documentType);
}
