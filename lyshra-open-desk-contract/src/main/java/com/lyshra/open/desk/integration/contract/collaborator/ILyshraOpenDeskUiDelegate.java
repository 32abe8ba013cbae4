package com.lyshra.open.desk.integration.contract.collaborator;

import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskAlertIndicator;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Navigation and dialogs owned by the hosting user interface.
 * Prompt methods complete empty when the user dismisses the dialog.
 */
public interface ILyshraOpenDeskUiDelegate {

    void navigate(String path);

    Mono<Void> reload();

    Mono<Void> copyToClipboard(String text);

    void openPrintPreview(String documentType, String name);

    void openNewDocument(String documentType, ILyshraOpenDeskDocument prefill);

    Mono<ILyshraOpenDeskRenameRequest> promptRename(String currentName);

    Mono<String> promptJumpToField(List<ILyshraOpenDeskFieldDefinition> fields);

    void focusField(String fieldName);

    Mono<ILyshraOpenDeskEmailMessage> promptEmail(String documentType, String name);

    Mono<String> promptText(String title, String message);

    Mono<Void> openLinks(Map<String, List<String>> linkedWith);

    void showAlert(String message, LyshraOpenDeskAlertIndicator indicator);

    /**
     * Origin used to build shareable document URLs, without a trailing slash.
     */
    String getBaseUrl();
}
