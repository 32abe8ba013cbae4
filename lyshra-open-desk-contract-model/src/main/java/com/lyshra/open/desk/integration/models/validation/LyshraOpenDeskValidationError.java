package com.lyshra.open.desk.integration.models.validation;

import com.lyshra.open.desk.integration.contract.validation.ILyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskValidationErrorType;
import lombok.Builder;
import lombok.Data;

import java.util.Optional;

@Data
@Builder
public class LyshraOpenDeskValidationError implements ILyshraOpenDeskValidationError {
    private final String fieldName;
    private final String label;
    private final String message;
    private final LyshraOpenDeskValidationErrorType type;
    private final Integer row;
    private final String tableName;

    @Override
    public Optional<Integer> getRow() {
        return Optional.ofNullable(row);
    }

    @Override
    public Optional<String> getTableName() {
        return Optional.ofNullable(tableName);
    }
}
