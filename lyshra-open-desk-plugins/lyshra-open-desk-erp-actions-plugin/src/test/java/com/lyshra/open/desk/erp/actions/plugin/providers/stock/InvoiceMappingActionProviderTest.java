package com.lyshra.open.desk.erp.actions.plugin.providers.stock;

import com.lyshra.open.desk.erp.actions.plugin.AbstractErpActionsTest;
import com.lyshra.open.desk.erp.actions.plugin.constant.ErpServerMethods;
import com.lyshra.open.desk.erp.actions.plugin.exception.ErpActionsErrorCodes;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.document.ILyshraOpenDeskDocument;
import com.lyshra.open.desk.integration.exception.LyshraOpenDeskActionExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceMappingActionProviderTest extends AbstractErpActionsTest {

    private final InvoiceMappingActionProvider provider = StockActionProviders.deliveryNote();

    @ParameterizedTest
    @ValueSource(ints = {0, 2})
    void onlySubmittedNotes_canBeInvoiced(int docStatus) {
        assertEquals(List.of(), actionIds(provider, context(savedDocument("Delivery Note", "DN-0001", docStatus))));
    }

    @Test
    void makeInvoice_opensTheMappedDraftUnsaved() {
        // Given
        ILyshraOpenDeskActionContext context = context(savedDocument("Delivery Note", "DN-0001", 1));
        gateway.respond(ErpServerMethods.MAKE_SALES_INVOICE_FROM_DELIVERY_NOTE,
                Map.of("doctype", "Sales Invoice", "customer", "Acme", "__islocal", 1));

        // When
        StepVerifier.create(run(action(provider, context, "delivery-note-make-invoice"), context)).verifyComplete();

        // Then
        assertEquals(Map.of("source_name", "DN-0001"),
                gateway.getCalls().get(ErpServerMethods.MAKE_SALES_INVOICE_FROM_DELIVERY_NOTE));
        ILyshraOpenDeskDocument invoice = ui.getOpenedDocuments().get("Sales Invoice");
        assertNotNull(invoice);
        assertEquals("Acme", invoice.get("customer"));
        assertTrue(gateway.getSavedDocuments().isEmpty());
    }

    @Test
    void emptyMapping_isReportedWithTheMethodName() {
        ILyshraOpenDeskActionContext context = context(savedDocument("Purchase Receipt", "PR-0001", 1));
        InvoiceMappingActionProvider receipts = StockActionProviders.purchaseReceipt();

        StepVerifier.create(run(action(receipts, context, "purchase-receipt-make-invoice"), context))
                .expectErrorSatisfies(error -> {
                    LyshraOpenDeskActionExecutionException exception = (LyshraOpenDeskActionExecutionException) error;
                    assertEquals(ErpActionsErrorCodes.MAPPED_DOCUMENT_MISSING, exception.getErrorInfo());
                    assertEquals(ErpServerMethods.MAKE_PURCHASE_INVOICE_FROM_PURCHASE_RECEIPT + " returned no document for PR-0001",
                            exception.getMessage());
                })
                .verify();
        assertTrue(ui.getOpenedDocuments().isEmpty());
    }

    @Test
    void stockEntry_isClaimedWithoutActions() {
        StockEntryActionProvider stockEntry = new StockEntryActionProvider();

        assertTrue(stockEntry.appliesTo("Stock Entry"));
        assertEquals(List.of(), actionIds(stockEntry, context(savedDocument("Stock Entry", "STE-0001", 1))));
    }
}
