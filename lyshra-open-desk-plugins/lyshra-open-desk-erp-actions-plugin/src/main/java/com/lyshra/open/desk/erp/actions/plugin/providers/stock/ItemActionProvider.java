package com.lyshra.open.desk.erp.actions.plugin.providers.stock;

import com.lyshra.open.desk.erp.actions.plugin.constant.ErpServerMethods;
import com.lyshra.open.desk.erp.actions.plugin.providers.AbstractErpActionProvider;
import com.lyshra.open.desk.erp.actions.plugin.providers.ErpActionSupport;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;
import com.lyshra.open.desk.integration.enumerations.LyshraOpenDeskActionGroup;
import com.lyshra.open.desk.integration.models.action.LyshraOpenDeskAction;
import com.lyshra.open.desk.integration.models.commons.LyshraOpenDeskValues;

import java.util.List;

public class ItemActionProvider extends AbstractErpActionProvider {

    public static final String PROVIDER_NAME = "ItemFeatureProvider";

    public ItemActionProvider() {
        super(PROVIDER_NAME, "Item");
    }

    @Override
    protected List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context) {
        return List.of(
                stockReport("item-stock-balance", "View Stock Balance", "Package", 200, ErpServerMethods.REPORT_STOCK_BALANCE),
                stockReport("item-stock-ledger", "View Stock Ledger", "BookOpen", 201, ErpServerMethods.REPORT_STOCK_LEDGER));
    }

    private ILyshraOpenDeskAction stockReport(String id, String label, String icon, int priority, String report) {
        return LyshraOpenDeskAction.builder()
                .id(id)
                .label(label)
                .group(LyshraOpenDeskActionGroup.ACTIONS)
                .icon(icon)
                .priority(priority)
                .showAsMenuItem()
                .requires(ErpActionSupport.savedDocument())
                .executor(context -> ErpActionSupport.navigate(context,
                        ErpActionSupport.reportPath(report, "item_code", itemCode(context))))
                .build();
    }

    static String itemCode(ILyshraOpenDeskActionContext context) {
        String itemCode = LyshraOpenDeskValues.cstr(context.requireDocument().get("item_code"));
        return itemCode.isEmpty() ? context.requireDocumentName() : itemCode;
    }
}
