package com.lyshra.open.desk.erp.actions.plugin.constant;

/**
 * Whitelisted server methods called through the document gateway.
 */
public interface ErpServerMethods {
    String RESET_PASSWORD = "frappe.core.doctype.user.user.reset_password";
    String IMPERSONATE = "frappe.core.doctype.user.user.impersonate";
    String GENERATE_KEYS = "frappe.core.doctype.user.user.generate_keys";

    String GET_PAYMENT_ENTRY = "erpnext.accounts.doctype.payment_entry.payment_entry.get_payment_entry";
    String MAKE_SALES_INVOICE_FROM_DELIVERY_NOTE = "erpnext.stock.doctype.delivery_note.delivery_note.make_sales_invoice";
    String MAKE_PURCHASE_INVOICE_FROM_PURCHASE_RECEIPT = "erpnext.stock.doctype.purchase_receipt.purchase_receipt.make_purchase_invoice";

    String REPORT_GENERAL_LEDGER = "General Ledger";
    String REPORT_STOCK_BALANCE = "Stock Balance";
    String REPORT_STOCK_LEDGER = "Stock Ledger";
    String REPORT_PERMITTED_DOCUMENTS = "Permitted Documents For User";
}
