package com.lyshra.open.desk.integration.contract.action;

import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskDocumentGateway;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskFormHandle;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskUiDelegate;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;

import java.util.List;
import java.util.Optional;

/**
 * Read-only snapshot providers and requirement checks operate over, plus the collaborators
 * action executors act through.
 */
public interface ILyshraOpenDeskActionContext {
    String getDocumentType();
    Optional<ILyshraOpenDeskDocument> getDocument();
    ILyshraOpenDeskDocTypeMetadata getMetadata();
    Optional<ILyshraOpenDeskDocumentOverlay> getOverlay();
    List<ILyshraOpenDeskWorkflowTransition> getWorkflowTransitions();
    String getCurrentUserId();
    List<String> getCurrentUserRoles();
    Optional<ILyshraOpenDeskDocumentGateway> getGateway();
    Optional<ILyshraOpenDeskUiDelegate> getUi();
    Optional<ILyshraOpenDeskFormHandle> getForm();

    /**
     * No document yet, or an unsaved one.
     */
    default boolean isNewDocument() {
        return getDocument().map(ILyshraOpenDeskDocument::isNew).orElse(true);
    }

    default Optional<String> getDocumentName() {
        return getDocument().flatMap(ILyshraOpenDeskDocument::getName);
    }

    default int getDocStatus() {
        return getDocument().map(ILyshraOpenDeskDocument::getDocStatus).orElse(0);
    }

    default ILyshraOpenDeskDocumentGateway requireGateway() {
        return getGateway().orElseThrow(() -> new IllegalStateException("No document gateway is available"));
    }

    default ILyshraOpenDeskUiDelegate requireUi() {
        return getUi().orElseThrow(() -> new IllegalStateException("No user interface is available"));
    }

    default ILyshraOpenDeskDocument requireDocument() {
        return getDocument().orElseThrow(() -> new IllegalStateException("No document is loaded"));
    }

    default String requireDocumentName() {
        return getDocumentName().orElseThrow(() -> new IllegalStateException("The document has not been saved yet"));
    }
}
