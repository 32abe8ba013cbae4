package com.lyshra.open.desk.core.engine.action.providers;

import com.lyshra.open.desk.core.engine.error.LyshraOpenDeskActionErrorHandler;
import com.lyshra.open.desk.core.engine.message.ILyshraOpenDeskMessageSource;
import com.lyshra.open.desk.core.exception.codes.LyshraOpenDeskErrorCodes;
import com.lyshra.open.desk.integration.constant.LyshraOpenDeskConstants;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskDocumentGateway;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskFormHandle;
import com.lyshra.open.desk.integration.contract.collaborator.ILyshraOpenDeskUiDelegate;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskDocTypeMetadata;
import com.lyshra.open.desk.integration.contract.metadata.ILyshraOpenDeskFieldDefinition;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskAlertIndicator;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskConfirmationType;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskPermissionType;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionRequirement;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskActionSupport.alert;
import static com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskActionSupport.documentPath;
import static com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskActionSupport.listPath;
import static com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskActionSupport.navigate;
import static com.lyshra.open.desk.core.engine.action.providers.LyshraOpenDeskActionSupport.reload;

/**
 * Toolbar actions every document type gets: save and submit flow, view helpers,
 * rename, duplicate, delete, print and email.
 */
@Slf4j
@RequiredArgsConstructor
public class LyshraOpenDeskCoreActionProvider implements ILyshraOpenDeskActionProvider {

    public static final String PROVIDER_NAME = "CoreActionProvider";

    private final ILyshraOpenDeskMessageSource messageSource;
    private final LyshraOpenDeskDocumentDuplicator documentDuplicator;

    @Override
    public String getName() {
        return PROVIDER_NAME;
    }

    @Override
    public List<ILyshraOpenDeskAction> getActions(ILyshraOpenDeskActionContext context) {
        ILyshraOpenDeskDocTypeMetadata metadata = context.getMetadata();
        boolean isNew = context.isNewDocument();
        int docStatus = context.getDocStatus();
        boolean submittable = metadata != null && metadata.isSubmittable();

        List<ILyshraOpenDeskAction> actions = new ArrayList<>();

        // primary
        if (isNew || docStatus == 0) {
            actions.add(save(isNew));
        }
        if (!isNew && submittable && docStatus == 0) {
            actions.add(submit());
        }
        if (!isNew && submittable && docStatus == 1) {
            actions.add(cancel());
        }
        if (!isNew && submittable && docStatus == 2) {
            actions.add(amend());
        }

        // view
        if (!isNew) {
            actions.add(reloadAction());
        }
        actions.add(copyToClipboard());
        if (metadata != null && !metadata.getFields().isEmpty()) {
            actions.add(jumpToField());
        }
        if (metadata != null && hasLinks(metadata)) {
            actions.add(links());
        }

        // document
        if (!isNew && metadata != null && metadata.isRenameAllowed()) {
            actions.add(rename());
        }
        if (!isNew) {
            actions.add(duplicate());
            actions.add(delete(context.getDocumentType()));
            actions.add(print());
            actions.add(downloadPdf());
            actions.add(email());
        }
        return actions;
    }

    private ILyshraOpenDeskAction save(boolean isNew) {
        return LyshraOpenDeskAction.builder()
                .id("save")
                .label("Save")
                .group(LyshraOpenDeskActionGroup.PRIMARY)
                .icon("Save")
                .priority(1)
                .primary()
                .requires(LyshraOpenDeskActionRequirement.permission(
                        isNew ? LyshraOpenDeskPermissionType.CREATE : LyshraOpenDeskPermissionType.WRITE))
                .executor(context -> {
                    Optional<ILyshraOpenDeskFormHandle> form = context.getForm();
                    if (form.isPresent()) {
                        return form.get().submit(LyshraOpenDeskSaveAction.SAVE);
                    }
                    return context.requireGateway()
                            .saveDocument(context.requireDocument(), LyshraOpenDeskSaveAction.SAVE)
                            .flatMap(saved -> {
                                Optional<String> savedName = saved.getName();
                                if (isNew && savedName.isPresent()) {
                                    return navigate(context, documentPath(context.getDocumentType(), savedName.get()));
                                }
                                return reload(context);
                            });
                })
                .build();
    }

    private ILyshraOpenDeskAction submit() {
        return LyshraOpenDeskAction.builder()
                .id("submit")
                .label("Submit")
                .group(LyshraOpenDeskActionGroup.PRIMARY)
                .icon("Check")
                .priority(2)
                .primary()
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.SUBMIT),
                        LyshraOpenDeskActionRequirement.docStatus(0))
                .confirm(confirmation -> confirmation
                        .title(messageSource.getMessage("action.submit.confirm.title"))
                        .message(messageSource.getMessage("action.submit.confirm.message"))
                        .type(LyshraOpenDeskConfirmationType.WARNING))
                .executor(context -> {
                    Optional<ILyshraOpenDeskFormHandle> form = context.getForm();
                    if (form.isPresent()) {
                        return form.get().submit(LyshraOpenDeskSaveAction.SUBMIT);
                    }
                    return context.requireGateway()
                            .saveDocument(context.requireDocument(), LyshraOpenDeskSaveAction.SUBMIT)
                            .then(reload(context));
                })
                .build();
    }

    private ILyshraOpenDeskAction cancel() {
        return LyshraOpenDeskAction.builder()
                .id("cancel")
                .label("Cancel")
                .group(LyshraOpenDeskActionGroup.PRIMARY)
                .icon("X")
                .priority(3)
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.CANCEL),
                        LyshraOpenDeskActionRequirement.docStatus(1))
                .confirm(confirmation -> confirmation
                        .title(messageSource.getMessage("action.cancel.confirm.title"))
                        .message(messageSource.getMessage("action.cancel.confirm.message"))
                        .type(LyshraOpenDeskConfirmationType.DANGER))
                .executor(context -> context.requireGateway()
                        .cancelDocument(context.getDocumentType(), context.requireDocumentName())
                        .then(reload(context)))
                .build();
    }

    private ILyshraOpenDeskAction amend() {
        return LyshraOpenDeskAction.builder()
                .id("amend")
                .label("Amend")
                .group(LyshraOpenDeskActionGroup.PRIMARY)
                .icon("FileEdit")
                .priority(4)
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.AMEND),
                        LyshraOpenDeskActionRequirement.docStatus(2))
                .executor(this::executeAmend)
                .build();
    }

    private Mono<Void> executeAmend(ILyshraOpenDeskActionContext context) {
        ILyshraOpenDeskDocumentGateway gateway = context.requireGateway();
        String documentType = context.getDocumentType();
        String name = context.requireDocumentName();

        return gateway.isDocumentAmended(documentType, name)
                .defaultIfEmpty(false)
                .flatMap(alreadyAmended -> {
                    if (Boolean.TRUE.equals(alreadyAmended)) {
                        return Mono.<Void>error(LyshraOpenDeskActionErrorHandler.create(
                                LyshraOpenDeskErrorCodes.DOCUMENT_ALREADY_AMENDED,
                                Map.of("doctype", documentType, "name", name),
                                messageSource));
                    }
                    return documentDuplicator.duplicate(context)
                            .map(copy -> copy.put(LyshraOpenDeskConstants.AMENDED_FROM, name))
                            .flatMap(copy -> gateway.saveDocument(copy, LyshraOpenDeskSaveAction.SAVE))
                            .flatMap(saved -> saved.getName()
                                    .map(savedName -> navigate(context, documentPath(documentType, savedName)))
                                    .orElse(Mono.empty()));
                });
    }

    private ILyshraOpenDeskAction reloadAction() {
        return LyshraOpenDeskAction.builder()
                .id("reload")
                .label("Reload")
                .group(LyshraOpenDeskActionGroup.VIEW)
                .icon("RefreshCw")
                .priority(20)
                .executor(LyshraOpenDeskActionSupport::reload)
                .build();
    }

    private ILyshraOpenDeskAction copyToClipboard() {
        return LyshraOpenDeskAction.builder()
                .id("copy-to-clipboard")
                .label("Copy to Clipboard")
                .group(LyshraOpenDeskActionGroup.VIEW)
                .icon("Clipboard")
                .priority(21)
                .executor(context -> {
                    ILyshraOpenDeskUiDelegate ui = context.requireUi();
                    String url = ui.getBaseUrl() + documentPath(context.getDocumentType(), context.requireDocumentName());
                    return ui.copyToClipboard(url)
                            .then(alert(context, messageSource.getMessage("action.alert.copied"), LyshraOpenDeskAlertIndicator.GREEN));
                })
                .build();
    }

    private ILyshraOpenDeskAction jumpToField() {
        return LyshraOpenDeskAction.builder()
                .id("jump-to-field")
                .label("Jump to Field")
                .group(LyshraOpenDeskActionGroup.VIEW)
                .icon("Navigation")
                .priority(22)
                .executor(context -> {
                    ILyshraOpenDeskUiDelegate ui = context.requireUi();
                    List<ILyshraOpenDeskFieldDefinition> fields = context.getMetadata().getFields().stream()
                            .filter(field -> field.getFieldName() != null)
                            .filter(field -> !LyshraOpenDeskConstants.LAYOUT_BREAK_FIELD_TYPES.contains(field.getFieldType()))
                            .toList();
                    return ui.promptJumpToField(fields)
                            .doOnNext(ui::focusField)
                            .then();
                })
                .build();
    }

    private ILyshraOpenDeskAction links() {
        return LyshraOpenDeskAction.builder()
                .id("links")
                .label("Links")
                .group(LyshraOpenDeskActionGroup.VIEW)
                .icon("Link2")
                .priority(23)
                .showAsMenuItem()
                .executor(context -> context.requireUi().openLinks(context.getMetadata().getLinkedWith()))
                .build();
    }

    private ILyshraOpenDeskAction rename() {
        return LyshraOpenDeskAction.builder()
                .id("rename")
                .label("Rename")
                .group(LyshraOpenDeskActionGroup.DOCUMENT)
                .icon("Edit3")
                .priority(30)
                .showAsMenuItem()
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.WRITE),
                        LyshraOpenDeskActionRequirement.notNew())
                .executor(context -> {
                    String documentType = context.getDocumentType();
                    String name = context.requireDocumentName();
                    ILyshraOpenDeskDocumentGateway gateway = context.requireGateway();
                    // an empty prompt means the dialog was dismissed
                    return context.requireUi().promptRename(name)
                            .flatMap(request -> gateway.renameDocument(documentType, name, request.getNewName(), request.isMerge()))
                            .flatMap(newName -> navigate(context, documentPath(documentType, newName)));
                })
                .build();
    }

    private ILyshraOpenDeskAction duplicate() {
        return LyshraOpenDeskAction.builder()
                .id("duplicate")
                .label("Duplicate")
                .group(LyshraOpenDeskActionGroup.DOCUMENT)
                .icon("Copy")
                .priority(31)
                .showAsMenuItem()
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.READ),
                        LyshraOpenDeskActionRequirement.notNew())
                .executor(context -> {
                    ILyshraOpenDeskUiDelegate ui = context.requireUi();
                    return documentDuplicator.duplicate(context)
                            .doOnNext(copy -> ui.openNewDocument(context.getDocumentType(), copy))
                            .then();
                })
                .build();
    }

    private ILyshraOpenDeskAction delete(String documentType) {
        return LyshraOpenDeskAction.builder()
                .id("delete")
                .label("Delete")
                .group(LyshraOpenDeskActionGroup.DOCUMENT)
                .icon("Trash2")
                .priority(32)
                .showAsMenuItem()
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.DELETE),
                        LyshraOpenDeskActionRequirement.notNew())
                .confirm(confirmation -> confirmation
                        .title(messageSource.getMessage("action.delete.confirm.title"))
                        .message(messageSource.getMessage("action.delete.confirm.message", Map.of("doctype", documentType)))
                        .type(LyshraOpenDeskConfirmationType.DANGER)
                        .requireTypedConfirmation(true))
                .executor(context -> context.requireGateway()
                        .deleteDocument(context.getDocumentType(), context.requireDocumentName())
                        .then(navigate(context, listPath(context.getDocumentType()))))
                .build();
    }

    private ILyshraOpenDeskAction print() {
        return LyshraOpenDeskAction.builder()
                .id("print-pdf")
                .label("Print")
                .group(LyshraOpenDeskActionGroup.PRINT)
                .icon("Printer")
                .priority(40)
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.PRINT),
                        LyshraOpenDeskActionRequirement.notNew())
                .executor(context -> Mono.fromRunnable(() -> context.requireUi()
                        .openPrintPreview(context.getDocumentType(), context.requireDocumentName())))
                .build();
    }

    private ILyshraOpenDeskAction downloadPdf() {
        return LyshraOpenDeskAction.builder()
                .id("download-pdf")
                .label("Download PDF")
                .group(LyshraOpenDeskActionGroup.PRINT)
                .icon("Download")
                .priority(41)
                .showAsMenuItem()
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.PRINT),
                        LyshraOpenDeskActionRequirement.notNew())
                .executor(context -> context.requireGateway()
                        .downloadPdf(context.getDocumentType(), context.requireDocumentName()))
                .build();
    }

    private ILyshraOpenDeskAction email() {
        return LyshraOpenDeskAction.builder()
                .id("email")
                .label("Email")
                .group(LyshraOpenDeskActionGroup.EMAIL)
                .icon("Mail")
                .priority(50)
                .requires(
                        LyshraOpenDeskActionRequirement.permission(LyshraOpenDeskPermissionType.EMAIL),
                        LyshraOpenDeskActionRequirement.notNew())
                .executor(context -> {
                    String documentType = context.getDocumentType();
                    String name = context.requireDocumentName();
                    ILyshraOpenDeskDocumentGateway gateway = context.requireGateway();
                    return context.requireUi().promptEmail(documentType, name)
                            .flatMap(message -> gateway.sendEmail(documentType, name, message)
                                    .then(alert(context, messageSource.getMessage("action.alert.email.sent"), LyshraOpenDeskAlertIndicator.GREEN)));
                })
                .build();
    }

    private static boolean hasLinks(ILyshraOpenDeskDocTypeMetadata metadata) {
        return !metadata.getLinkedWith().isEmpty()
                || metadata.getFields().stream()
                        .anyMatch(field -> LyshraOpenDeskConstants.FIELD_TYPE_LINK.equals(field.getFieldType()));
    }
}
