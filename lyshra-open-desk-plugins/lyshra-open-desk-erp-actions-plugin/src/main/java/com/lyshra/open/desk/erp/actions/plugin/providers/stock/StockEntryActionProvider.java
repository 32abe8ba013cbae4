package com.lyshra.open.desk.erp.actions.plugin.providers.stock;

import com.lyshra.open.desk.erp.actions.plugin.providers.AbstractErpActionProvider;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskAction;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionContext;

import java.util.List;

/**
 * Claims Stock Entry so the document type is known to the plugin. Contributes no actions yet.
 */
public class StockEntryActionProvider extends AbstractErpActionProvider {

    public static final String PROVIDER_NAME = "StockEntryFeatureProvider";

    public StockEntryActionProvider() {
        super(PROVIDER_NAME, "Stock Entry");
    }

    @Override
    protected List<ILyshraOpenDeskAction> createActions(ILyshraOpenDeskActionContext context) {
        return List.of();
    }
}
