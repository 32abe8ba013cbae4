package com.lyshra.open.desk.integration.models.action;

import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskWorkflowTransition;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskDocumentGateway;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskFormHandle;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskUiDelegate;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocumentOverlay;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
public class LyshraOpenDeskActionContext implements ILyshraOpenDeskActionContext {
    private final String documentType;
    private final ILyshraOpenDeskDocument document;
    private final ILyshraOpenDeskDocTypeMetadata metadata;
    private final ILyshraOpenDeskDocumentOverlay overlay;
    @Builder.Default
    private final List<ILyshraOpenDeskWorkflowTransition> workflowTransitions = List.of();
    private final String currentUserId;
    @Builder.Default
    private final List<String> currentUserRoles = List.of();
    private final ILyshraOpenDeskDocumentGateway gateway;
    private final ILyshraOpenDeskUiDelegate ui;
    private final ILyshraOpenDeskFormHandle form;

    @Override
    public Optional<ILyshraOpenDeskDocument> getDocument() {
        return Optional.ofNullable(document);
    }

    @Override
    public Optional<ILyshraOpenDeskDocumentOverlay> getOverlay() {
        return Optional.ofNullable(overlay);
    }

    @Override
    public Optional<ILyshraOpenDeskDocumentGateway> getGateway() {
        return Optional.ofNullable(gateway);
    }

    @Override
    public Optional<ILyshraOpenDeskUiDelegate> getUi() {
        return Optional.ofNullable(ui);
    }

    @Override
    public Optional<ILyshraOpenDeskFormHandle> getForm() {
        return Optional.ofNullable(form);
    }
}
