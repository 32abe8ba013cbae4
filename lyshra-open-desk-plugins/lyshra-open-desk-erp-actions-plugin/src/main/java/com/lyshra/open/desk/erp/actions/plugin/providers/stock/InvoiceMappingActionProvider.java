package com.lyshra.open.desk.erp.actions.plugin.providers.stock;

import com.lyshra.open.desk.erp.actions.plugin.providers.AbstractErpActionProvider;
import com.lyshra.open.desk.erp.actions.plugin.providers.ErpActionSupport;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Maps a submitted stock transaction to a draft invoice and opens it unsaved.
 */
@Slf4j
public class InvoiceMappingActionProvider extends AbstractErpActionProvider {

    private final String actionId;
    private final String label;
    private final String mapperMethod;
    private final String targetDocumentType;

    public InvoiceMappingActionProvider(
            String name,
            String documentType,
            String actionId,
            String label,
            String mapperMethod,
            String targetDocumentType) {

        super(name, documentType);
        this.actionId = actionId;
        this.label = label;
        this.mapperMethod = mapperMethod;
        this.targetDocumentType = targetDocumentType;
    }

    @Override
    protected boolean isSubmittedOnly() {
        return true;
    }

    @Override
    protected List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context) {
        return List.of(LyshraOpenDeskAction.builder()
                .id(actionId)
                .label(label)
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon("FileText")
                .priority(ErpActionSupport.ACTIONS_PRIORITY)
                .showAsMenuItem()
                .requires(ErpActionSupport.submittedDocument())
                .executor(this::makeInvoice)
                .build());
    }

    private Mono<Void> makeInvoice(ILyshraOpenDeskActionContext context) {
        log.debug("Mapping [{}] [{}] to a new [{}]", getDocumentType(), context.getDocumentName().orElse(null), targetDocumentType);
        return ErpActionSupport.mapDocument(context, mapperMethod, Map.of("source_name", context.requireDocumentName()))
                .flatMap(invoice -> Mono.fromRunnable(() -> context.requireUi().openNewDocument(targetDocumentType, invoice)));
    }
}
