package com.lyshra.open.desk.integration.contract.validation;

import java.util.List;
import java.util.Optional;

public interface ILyshraOpenDeskValidationResult {
    boolean isValid();
    List<ILyshraOpenDeskValidationError> getErrors();
    Optional<String> getFirstErrorField();
}
