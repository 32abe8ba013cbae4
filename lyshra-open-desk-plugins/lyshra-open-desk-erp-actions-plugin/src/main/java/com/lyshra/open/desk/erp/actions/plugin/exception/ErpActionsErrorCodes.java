package com.lyshra.open.desk.erp.actions.plugin.exception;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskErrorInfo;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;

@AllArgsConstructor
@Getter
public enum ErpActionsErrorCodes implements ILyshraOpenDeskErrorInfo {

    IMPERSONATION_REASON_REQUIRED(
            "ERP_ACTIONS_ERR_0001",
            "Reason is required for impersonation",
            "Enter the reason that will be shared with {user}"
    ),

    MAPPED_DOCUMENT_MISSING(
            "ERP_ACTIONS_ERR_0002",
            "{method} returned no document for {name}",
            "Check that {name} is submitted and not fully billed"
    ),

    ;

    private final String errorCode;
    private final String errorTemplate;
    private final String resolutionTemplate;

    /**
     * Error message with each {@code {name}} placeholder replaced.
     */
    public String format(Map<String, String> templateVariables) {
        String message = errorTemplate;
        for (Map.Entry<String, String> variable : templateVariables.entrySet()) {
            message = message.replace("{" + variable.getKey() + "}", variable.getValue());
        }
        return message;
    }
}
