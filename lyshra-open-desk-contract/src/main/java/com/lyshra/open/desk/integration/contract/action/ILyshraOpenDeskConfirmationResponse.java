package com.lyshra.open.desk.integration.contract.action;

import java.util.Optional;

/**
 * The caller's answer to an action confirmation dialog.
 */
public interface ILyshraOpenDeskConfirmationResponse {
    boolean isAccepted();
    Optional<String> getTypedText();
}
