package com.lyshra.open.desk.erp.actions.plugin;

import com.lyshra.open.desk.erp.actions.plugin.providers.accounts.AccountsActionProviders;
import com.lyshra.open.desk.erp.actions.plugin.providers.stock.StockActionProviders;
import com.lyshra.open.desk.erp.actions.plugin.providers.user.UserActionProvider;
import com.lyshra.open.desk.integration.ILyshraOpenDeskActionProviderPlugin;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginFacade;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginIdentifier;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import com.lyshra.open.desk.integration.models.LyshraOpenDeskPluginIdentifier;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class LyshraOpenDeskErpActionsPlugin implements ILyshraOpenDeskActionProviderPlugin {

    public static final ILyshraOpenDeskPluginIdentifier IDENTIFIER = LyshraOpenDeskPluginIdentifier.builder()
            .organization("com.lyshra.open.desk")
            .module("erp-actions")
            .version("1.0.0")
            .build();

    @Override
    public ILyshraOpenDeskPluginIdentifier getIdentifier() {
        return IDENTIFIER;
    }

    @Override
    public List<ILyshraOpenDeskActionProvider> create(ILyshraOpenDeskPluginFacade facade) {
        List<ILyshraOpenDeskActionProvider> providers = new ArrayList<>();
        providers.add(new UserActionProvider());
        providers.addAll(StockActionProviders.all());
        providers.addAll(AccountsActionProviders.all());
        log.info("Created [{}] ERP action providers", providers.size());
        return providers;
    }
}
