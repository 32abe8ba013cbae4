package com.lyshra.open.desk.integration.enumerations;

public enum LyshraOpenDeskValidationErrorType {
    MANDATORY,
    FORMAT,
    LENGTH,
    CUSTOM
}
