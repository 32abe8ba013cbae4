package com.lyshra.open.desk.erp.actions.plugin.providers.accounts;

import com.lyshra.open.desk.erp.actions.plugin.providers.AbstractErpActionProvider;
import com.lyshra.open.desk.erp.actions.plugin.providers.ErpActionSupport;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;

import java.util.List;

/**
 * Invoice, voucher and ledger account shortcuts.
 */
public final class AccountsActionProviders {

    private AccountsActionProviders() {
    }

    public static ILyshraOpenDeskActionProvider salesInvoice() {
        return invoice("SalesInvoiceFeatureProvider", "Sales Invoice", "sales-invoice");
    }

    public static ILyshraOpenDeskActionProvider purchaseInvoice() {
        return invoice("PurchaseInvoiceFeatureProvider", "Purchase Invoice", "purchase-invoice");
    }

    public static ILyshraOpenDeskActionProvider paymentEntry() {
        return voucher("PaymentEntryFeatureProvider", "Payment Entry", "payment-entry");
    }

    public static ILyshraOpenDeskActionProvider journalEntry() {
        return voucher("JournalEntryFeatureProvider", "Journal Entry", "journal-entry");
    }

    public static ILyshraOpenDeskActionProvider account() {
        return new AbstractErpActionProvider("AccountFeatureProvider", "Account") {
            @Override
            protected List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context) {
                return List.of(ErpActionSupport.viewLedger("account-view-ledger", 200, "account", false));
            }
        };
    }

    public static List<ILyshraOpenDeskActionProvider> all() {
        return List.of(salesInvoice(), purchaseInvoice(), paymentEntry(), journalEntry(), account());
    }

    private static ILyshraOpenDeskActionProvider invoice(String name, String documentType, String idPrefix) {
        return new SubmittedDocumentProvider(name, documentType, List.of(
                ErpActionSupport.makePayment(idPrefix + "-make-payment"),
                ErpActionSupport.viewLedger(idPrefix + "-view-ledger", 201, "voucher_no", true)));
    }

    private static ILyshraOpenDeskActionProvider voucher(String name, String documentType, String idPrefix) {
        return new SubmittedDocumentProvider(name, documentType, List.of(
                ErpActionSupport.viewLedger(idPrefix + "-view-ledger", 200, "voucher_no", true)));
    }

    private static class SubmittedDocumentProvider extends AbstractErpActionProvider {

        private final List<ILyshraOpenDeskAction> actions;

        SubmittedDocumentProvider(String name, String documentType, List<ILyshraOpenDeskAction> actions) {
            super(name, documentType);
            this.actions = actions;
        }

        @Override
        protected boolean isSubmittedOnly() {
            return true;
        }

        @Override
        protected List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context) {
            return actions;
        }
    }
}
