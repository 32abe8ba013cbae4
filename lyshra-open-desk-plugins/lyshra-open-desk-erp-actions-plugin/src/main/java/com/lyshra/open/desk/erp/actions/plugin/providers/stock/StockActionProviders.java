package com.lyshra.open.desk.erp.actions.plugin.providers.stock;

import com.lyshra.open.desk.erp.actions.plugin.constant.ErpServerMethods;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;

import java.util.List;

public final class StockActionProviders {

    private StockActionProviders() {
    }

    public static InvoiceMappingActionProvider deliveryNote() {
        return new InvoiceMappingActionProvider(
                "DeliveryNoteFeatureProvider",
                "Delivery Note",
                "delivery-note-make-invoice",
                "Make Sales Invoice",
                ErpServerMethods.MAKE_SALES_INVOICE_FROM_DELIVERY_NOTE,
                "Sales Invoice");
    }

    public static InvoiceMappingActionProvider purchaseReceipt() {
        return new InvoiceMappingActionProvider(
                "PurchaseReceiptFeatureProvider",
                "Purchase Receipt",
                "purchase-receipt-make-invoice",
                "Make Purchase Invoice",
                ErpServerMethods.MAKE_PURCHASE_INVOICE_FROM_PURCHASE_RECEIPT,
                "Purchase Invoice");
    }

    public static List<ILyshraOpenDeskActionProvider> all() {
        return List.of(new ItemActionProvider(), deliveryNote(), purchaseReceipt(), new StockEntryActionProvider());
    }
}
