package com.lyshra.open.desk.core.exception.codes;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum LyshraOpenDeskErrorCodes implements ILyshraOpenDeskErrorInfo {

    ACTION_EXECUTION_FAILED(
            "DESK_ERR_0001",
            "action.execution.failed",
            "action.execution.failed.resolution"
    ),

    ACTION_TYPED_CONFIRMATION_MISMATCH(
            "DESK_ERR_0002",
            "action.typed.confirmation.mismatch",
            "action.typed.confirmation.mismatch.resolution"
    ),

    DOCUMENT_ALREADY_AMENDED(
            "DESK_ERR_0003",
            "document.already.amended",
            "document.already.amended.resolution"
    ),

    DOCUMENT_LOAD_FAILED(
            "DESK_ERR_0004",
            "document.load.failed",
            "document.load.failed.resolution"
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
    private final String resolutionTemplate;
}
