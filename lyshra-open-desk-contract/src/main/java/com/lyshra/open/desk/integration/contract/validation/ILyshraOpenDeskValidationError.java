package com.lyshra.open.desk.integration.contract.validation;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskValidationErrorType;

import java.util.Optional;

public interface ILyshraOpenDeskValidationError {
    String getFieldName();
    String getLabel();
    String getMessage();
    LyshraOpenDeskValidationErrorType getType();

    /**
     * 1-based row of the child table the error belongs to.
     */
    Optional<Integer> getRow();

    /**
     * Label of the child table the error belongs to.
     */
    Optional<String> getTableName();
}
