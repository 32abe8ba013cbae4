package com.lyshra.open.desk.core.engine.action.providers;

import com.lyshra.open.desk.core.engine.AbstractEngineTest;
import com.lyshra.open.desk.core.engine.action.LyshraOpenDeskActionProviderRegistry;
import com.lyshra.open.desk.core.engine.support.FakeDocumentGateway;
import com.lyshra.open.desk.core.engine.support.FakeFormHandle;
import com.lyshra.open.desk.core.engine.support.RecordingUiDelegate;
import com.lyshra.open.desk.core.exception.codes.LyshraOpenDeskErrorCodes;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskConfirmationResponse;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import com.lyshra.open.desk.integration.exception.LyshraOpenDeskActionExecutionException;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskConfirmationResponse;
import com.lyshra.open.desk.integration.models.collaborator.LyshraOpenDeskEmailMessage;
import com.lyshra.open.desk.integration.models.collaborator.LyshraOpenDeskRenameRequest;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.models.metadata.LyshraOpenDeskDocTypeMetadata;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LyshraOpenDeskCoreActionProviderTest extends AbstractEngineTest {

    private final LyshraOpenDeskCoreActionProvider provider = new LyshraOpenDeskCoreActionProvider(
            facade.getMessageSource(), new LyshraOpenDeskDocumentDuplicator(facade.getMessageSource()));

    private FakeDocumentGateway gateway;
    private RecordingUiDelegate ui;

    @BeforeEach
    void setUp() {
        gateway = new FakeDocumentGateway();
        gateway.getDocuments().put("Sales Order/SO-0001", salesOrder());
        gateway.getMetadata().put("Sales Order Item", salesOrderItemMeta());
        ui = new RecordingUiDelegate();
    }

    private LyshraOpenDeskActionContext.LyshraOpenDeskActionContextBuilder order(ILyshraOpenDeskDocument document) {
        return LyshraOpenDeskActionContext.builder()
                .documentType("Sales Order")
                .document(document)
                .metadata(salesOrderMeta())
                .overlay(salesOrderDocInfo())
                .currentUserId(SALES_USER)
                .currentUserRoles(List.of("Sales User"))
                .gateway(gateway)
                .ui(ui);
    }

    private List<String> candidateIds(ILyshraOpenDeskActionContext context) {
        return provider.getActions(context).stream().map(ILyshraOpenDeskAction::getId).toList();
    }

    private ILyshraOpenDeskAction find(ILyshraOpenDeskActionContext context, String id) {
        return provider.getActions(context).stream()
                .filter(action -> action.getId().equals(id))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No action " + id));
    }

    private Mono<Void> run(ILyshraOpenDeskActionContext context, String id, ILyshraOpenDeskConfirmationResponse response) {
        return facade.getActionInvoker().invoke(find(context, id), context, response);
    }

    private Mono<Void> run(ILyshraOpenDeskActionContext context, String id) {
        return run(context, id, LyshraOpenDeskConfirmationResponse.accepted());
    }

    @Nested
    @DisplayName("Candidate actions")
    class Candidates {

        @Test
        void newDocument_getsSaveAndViewHelpersOnly() {
            List<String> ids = candidateIds(order(null).build());

            assertEquals(List.of("save", "copy-to-clipboard", "jump-to-field", "links"), ids);
        }

        @Test
        void draftOfSubmittableType_getsTheFullToolbar() {
            List<String> ids = candidateIds(order(salesOrder()).build());

            assertEquals(List.of("save", "submit", "reload", "copy-to-clipboard", "jump-to-field", "links", "rename",
                    "duplicate", "delete", "print-pdf", "download-pdf", "email"), ids);
        }

        @Test
        void submittedDocument_offersCancelInsteadOfSaveAndSubmit() {
            List<String> ids = candidateIds(order(salesOrder().put("docstatus", 1)).build());

            assertTrue(ids.contains("cancel"));
            assertFalse(ids.contains("save"));
            assertFalse(ids.contains("submit"));
            assertFalse(ids.contains("amend"));
        }

        @Test
        void cancelledDocument_offersAmend() {
            List<String> ids = candidateIds(order(salesOrder().put("docstatus", 2)).build());

            assertTrue(ids.contains("amend"));
            assertFalse(ids.contains("cancel"));
        }

        @Test
        void nonSubmittableType_hasNoSubmitFlow() {
            LyshraOpenDeskDocTypeMetadata note = LyshraOpenDeskDocTypeMetadata.builder().name("Note").build();
            List<String> ids = candidateIds(order(salesOrder()).documentType("Note").metadata(note).build());

            assertTrue(ids.contains("save"));
            assertFalse(ids.contains("submit"));
            assertFalse(ids.contains("rename"));
            assertFalse(ids.contains("jump-to-field"));
            assertFalse(ids.contains("links"));
        }

        @Test
        void manifest_filtersByTheServerPermissionsAndSorts() {
            LyshraOpenDeskActionProviderRegistry registry = new LyshraOpenDeskActionProviderRegistry().register(provider);

            List<String> ids = facade.createManifestBuilder(registry).build(order(salesOrder()).build())
                    .getActions().stream().map(ILyshraOpenDeskAction::getId).toList();

            // delete is denied by the document overlay
            assertEquals(List.of("save", "submit", "reload", "copy-to-clipboard", "jump-to-field", "links", "rename",
                    "duplicate", "print-pdf", "download-pdf", "email"), ids);
        }

        @Test
        void primaryFlags_matchTheSaveAndSubmitFlow() {
            ILyshraOpenDeskActionContext context = order(salesOrder()).build();

            assertTrue(find(context, "save").isPrimary());
            assertTrue(find(context, "submit").isPrimary());
            assertFalse(find(order(salesOrder().put("docstatus", 1)).build(), "cancel").isPrimary());
            assertTrue(find(context, "delete").getConfirmation().orElseThrow().isRequireTypedConfirmation());
        }
    }

    @Nested
    @DisplayName("Save and submit")
    class SaveAndSubmit {

        @Test
        void save_goesThroughTheFormWhenOneIsAttached() {
            FakeFormHandle form = new FakeFormHandle();

            StepVerifier.create(run(order(salesOrder()).form(form).build(), "save")).verifyComplete();

            assertEquals(List.of(LyshraOpenDeskSaveAction.SAVE), form.getSubmissions());
            assertTrue(gateway.getCalls().isEmpty());
        }

        @Test
        void savingANewDocument_navigatesToTheSavedName() {
            ILyshraOpenDeskDocument draft = new LyshraOpenDeskDocument().put("doctype", "Sales Order").put("__islocal", 1);

            StepVerifier.create(run(order(draft).build(), "save")).verifyComplete();

            assertEquals(List.of("save:SAVE"), gateway.getCalls());
            assertEquals(List.of("/app/sales-order/NEW-0001"), ui.getNavigations());
        }

        @Test
        void savingAnExistingDocument_reloads() {
            StepVerifier.create(run(order(salesOrder()).build(), "save")).verifyComplete();

            assertEquals(1, ui.getReloads());
            assertTrue(ui.getNavigations().isEmpty());
        }

        @Test
        void submit_savesWithTheSubmitAction() {
            StepVerifier.create(run(order(salesOrder()).build(), "submit")).verifyComplete();

            assertEquals(List.of("save:SUBMIT"), gateway.getCalls());
            assertEquals(1, ui.getReloads());
        }

        @Test
        void declinedSubmit_doesNothing() {
            StepVerifier.create(run(order(salesOrder()).build(), "submit", LyshraOpenDeskConfirmationResponse.declined()))
                    .verifyComplete();

            assertTrue(gateway.getCalls().isEmpty());
        }

        @Test
        void cancel_cancelsOnTheServerAndReloads() {
            StepVerifier.create(run(order(salesOrder().put("docstatus", 1)).build(), "cancel")).verifyComplete();

            assertEquals(List.of("cancel:SO-0001"), gateway.getCalls());
            assertEquals(1, ui.getReloads());
        }
    }

    @Nested
    @DisplayName("Amend")
    class Amend {

        @Test
        void amend_savesACleanCopyLinkedToTheOriginal() {
            StepVerifier.create(run(order(salesOrder().put("docstatus", 2)).build(), "amend")).verifyComplete();

            ILyshraOpenDeskDocument saved = gateway.getSavedDocuments().get(0);
            assertEquals("SO-0001", saved.get("amended_from"));
            assertEquals(0, saved.getDocStatus());
            assertTrue(saved.getName().isEmpty());
            assertEquals(List.of("/app/sales-order/NEW-0001"), ui.getNavigations());
        }

        @Test
        void alreadyAmendedDocument_failsWithACode() {
            gateway.setAmended(true);

            StepVerifier.create(run(order(salesOrder().put("docstatus", 2)).build(), "amend"))
                    .expectErrorSatisfies(error -> assertEquals(
                            LyshraOpenDeskErrorCodes.DOCUMENT_ALREADY_AMENDED,
                            ((LyshraOpenDeskActionExecutionException) error).getErrorInfo()))
                    .verify();

            assertTrue(gateway.getSavedDocuments().isEmpty());
        }
    }

    @Nested
    @DisplayName("View and document helpers")
    class Helpers {

        @Test
        void copyToClipboard_copiesTheAbsoluteUrl() {
            StepVerifier.create(run(order(salesOrder()).build(), "copy-to-clipboard")).verifyComplete();

            assertEquals(List.of("https://erp.example.com/app/sales-order/SO-0001"), ui.getClipboard());
            assertEquals(List.of("GREEN:Copied to clipboard"), ui.getAlerts());
        }

        @Test
        void copyToClipboard_onANewDocument_fails() {
            StepVerifier.create(run(order(null).build(), "copy-to-clipboard"))
                    .expectError(LyshraOpenDeskActionExecutionException.class)
                    .verify();
        }

        @Test
        void jumpToField_focusesThePickedField() {
            ui.setJumpAnswer("customer");

            StepVerifier.create(run(order(salesOrder()).build(), "jump-to-field")).verifyComplete();

            assertEquals(List.of("customer"), ui.getFocusedFields());
        }

        @Test
        void links_openTheLinkedDocTypes() {
            StepVerifier.create(run(order(salesOrder()).build(), "links")).verifyComplete();

            assertEquals(salesOrderMeta().getLinkedWith(), ui.getOpenedLinks());
        }

        @Test
        void rename_renamesAndNavigates() {
            ui.setRenameAnswer(new LyshraOpenDeskRenameRequest("SO-0099", true));

            StepVerifier.create(run(order(salesOrder()).build(), "rename")).verifyComplete();

            assertEquals(List.of("rename:SO-0001->SO-0099:merge"), gateway.getCalls());
            assertEquals(List.of("/app/sales-order/SO-0099"), ui.getNavigations());
        }

        @Test
        void dismissedRename_doesNothing() {
            StepVerifier.create(run(order(salesOrder()).build(), "rename")).verifyComplete();

            assertTrue(gateway.getCalls().isEmpty());
        }

        @Test
        void duplicate_opensAnUnsavedCopy() {
            StepVerifier.create(run(order(salesOrder()).build(), "duplicate")).verifyComplete();

            ILyshraOpenDeskDocument copy = ui.getOpenedDocuments().get("Sales Order");
            assertNotNull(copy);
            assertTrue(copy.isNew());
            assertEquals("Acme", copy.get("customer"));
            assertFalse(copy.containsKey("po_no"));
        }

        @Test
        void delete_requiresTheTypedNameThenGoesBackToTheList() {
            ILyshraOpenDeskActionContext context = order(salesOrder()).build();

            StepVerifier.create(run(context, "delete", LyshraOpenDeskConfirmationResponse.acceptedWithText("SO-0001")))
                    .verifyComplete();

            assertEquals(List.of("delete:SO-0001"), gateway.getCalls());
            assertEquals(List.of("/app/sales-order"), ui.getNavigations());
        }

        @Test
        void failedDelete_staysOnTheDocument() {
            gateway.setFailure(new IllegalStateException("Cannot delete linked document"));

            StepVerifier.create(run(order(salesOrder()).build(), "delete", LyshraOpenDeskConfirmationResponse.acceptedWithText("SO-0001")))
                    .expectErrorMessage("Delete failed: Cannot delete linked document")
                    .verify();

            assertTrue(ui.getNavigations().isEmpty());
        }

        @Test
        void print_opensThePreview_andPdfDownloads() {
            ILyshraOpenDeskActionContext context = order(salesOrder()).build();

            StepVerifier.create(run(context, "print-pdf").then(run(context, "download-pdf"))).verifyComplete();

            assertEquals(List.of("Sales Order/SO-0001"), ui.getPrintPreviews());
            assertEquals(List.of("pdf:SO-0001"), gateway.getCalls());
        }

        @Test
        void email_sendsTheComposedMessage() {
            ui.setEmailAnswer(LyshraOpenDeskEmailMessage.builder()
                    .recipients("buyer@acme.example")
                    .subject("Sales Order SO-0001")
                    .content("Please find attached")
                    .build());

            StepVerifier.create(run(order(salesOrder()).build(), "email")).verifyComplete();

            assertEquals(List.of("email:buyer@acme.example"), gateway.getCalls());
            assertEquals(List.of("GREEN:Email sent"), ui.getAlerts());
        }

        @Test
        void actionsWithoutAUserInterface_failWithAClearMessage() {
            ILyshraOpenDeskActionContext headless = order(salesOrder()).ui(null).build();

            StepVerifier.create(run(headless, "print-pdf"))
                    .expectErrorMessage("Print failed: No user interface is available")
                    .verify();
        }
    }

    @Test
    void confirmationMessages_comeFromTheMessageBundle() {
        ILyshraOpenDeskAction delete = find(order(salesOrder()).build(), "delete");

        assertEquals("Are you sure you want to delete this Sales Order?", delete.getConfirmation().orElseThrow().getMessage());
    }
}
