package com.lyshra.open.desk.erp.actions.plugin.providers;

import com.lyshra.open.desk.erp.actions.plugin.constant.ErpServerMethods;
import com.lyshra.open.desk.erp.actions.plugin.exception.ErpActionsErrorCodes;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionRequirement;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskSaveAction;
import com.lyshra.open.desk.integration.exception.LyshraOpenDeskActionExecutionException;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskActionRequirement;
import com.lyshra.open.desk.integration.models.document.LyshraOpenDeskDocument;
import reactor.core.publisher.Mono;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;

public final class ErpActionSupport {

    public static final int ACTIONS_PRIORITY = 200;

    private ErpActionSupport() {
    }

    public static ILyshraOpenDeskActionRequirement[] savedDocument() {
        return new ILyshraOpenDeskActionRequirement[] {LyshraOpenDeskActionRequirement.notNew()};
    }

    public static ILyshraOpenDeskActionRequirement[] submittedDocument() {
        return new ILyshraOpenDeskActionRequirement[] {
                LyshraOpenDeskActionRequirement.notNew(),
                LyshraOpenDeskActionRequirement.docStatus(1)
        };
    }

    /**
     * Opens the General Ledger report filtered on the current document.
     */
    public static ILyshraOpenDeskAction viewLedger(String id, int priority, String filterName, boolean submittedOnly) {
        return LyshraOpenDeskAction.builder()
                .id(id)
                .label("View Ledger")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("BookOpen")
                .priority(priority)
                .showAsMenuItem()
                .requires(submittedOnly ? submittedDocument() : savedDocument())
                .executor(context -> navigate(context,
                        reportPath(ErpServerMethods.REPORT_GENERAL_LEDGER, filterName, context.requireDocumentName())))
                .build();
    }

    /**
     * Creates a payment entry against the current invoice, saves it and opens it.
     */
    public static ILyshraOpenDeskAction makePayment(String id) {
        return LyshraOpenDeskAction.builder()
                .id(id)
                .label("Make Payment")
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("DollarSign")
                .priority(ACTIONS_PRIORITY)
                .showAsMenuItem()
                .requires(submittedDocument())
                .executor(context -> mapDocument(context, ErpServerMethods.GET_PAYMENT_ENTRY,
                        Map.of("dt", context.getDocumentType(), "dn", context.requireDocumentName()))
                        .flatMap(payment -> context.requireGateway().saveDocument(payment, LyshraOpenDeskSaveAction.SAVE))
                        .flatMap(saved -> navigate(context, documentPath("Payment Entry", saved.getName().orElse("")))))
                .build();
    }

    /**
     * Calls a server mapper method and wraps the returned document. An empty answer is an error.
     */
    public static Mono<LyshraOpenDeskDocument> mapDocument(
            ILyshraOpenDeskActionContext context,
            String method,
            Map<String, Object> arguments) {

        String name = context.requireDocumentName();
        return context.requireGateway()
                .callMethod(method, arguments)
                .filter(document -> !document.isEmpty())
                .switchIfEmpty(Mono.error(() -> {
                    Map<String, String> variables = Map.of("method", method, "name", name);
                    return new LyshraOpenDeskActionExecutionException(
                            ErpActionsErrorCodes.MAPPED_DOCUMENT_MISSING, variables,
                            ErpActionsErrorCodes.MAPPED_DOCUMENT_MISSING.format(variables));
                }))
                .map(LyshraOpenDeskDocument::of);
    }

    public static Mono<Void> navigate(ILyshraOpenDeskActionContext context, String path) {
        return Mono.fromRunnable(() -> context.getUi().ifPresent(ui -> ui.navigate(path)));
    }

    public static String documentPath(String documentType, String name) {
        return "/app/" + slug(documentType) + "/" + name;
    }

    public static String listPath(String documentType, String filterName, String filterValue) {
        return "/app/" + slug(documentType) + "?" + filterName + "=" + encode(filterValue);
    }

    public static String reportPath(String report, String filterName, String filterValue) {
        return "/app/query-report/" + report + "?" + filterName + "=" + encode(filterValue);
    }

    static String slug(String documentType) {
        return documentType.toLowerCase(Locale.ROOT).replace(' ', '-');
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
