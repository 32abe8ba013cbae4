package com.lyshra.open.desk.integration.contract.action;

import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskConfirmationType;

import java.util.Optional;

public interface ILyshraOpenDeskActionConfirmation {
    String getMessage();
    Optional<String> getTitle();
    LyshraOpenDeskConfirmationType getType();

    /**
     * The user must type the document name to confirm.
     */
    boolean isRequireTypedConfirmation();
}
