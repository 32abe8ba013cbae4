package com.lyshra.open.desk.integration.models.validation;

import com.lyshra.open.desk.integration.contract.validation.ILyshraOpenDeskValidationError;
import com.lyshra.open.desk.integration.contract.validation.ILyshraOpenDeskValidationResult;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
public class LyshraOpenDeskValidationResult implements ILyshraOpenDeskValidationResult {
    private final boolean valid;
    private final List<ILyshraOpenDeskValidationError> errors;
    private final String firstErrorField;

    @Override
    public Optional<String> getFirstErrorField() {
        return Optional.ofNullable(firstErrorField);
    }

    public static LyshraOpenDeskValidationResult valid() {
        return new LyshraOpenDeskValidationResult(true, List.of(), null);
    }

    public static LyshraOpenDeskValidationResult of(List<? extends ILyshraOpenDeskValidationError> errors) {
        if (errors.isEmpty()) {
            return valid();
        }
        return new LyshraOpenDeskValidationResult(false, List.copyOf(errors), errors.get(0).getFieldName());
    }
}
