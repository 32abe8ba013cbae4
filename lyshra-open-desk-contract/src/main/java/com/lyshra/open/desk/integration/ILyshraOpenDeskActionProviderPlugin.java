package com.lyshra.open.desk.integration;

import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginFacade;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginIdentifier;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;

import java.util.List;

/**
 * Entry point of an action plugin, discovered with {@link java.util.ServiceLoader}.
 * Implementations are listed in {@code META-INF/services/com.lyshra.open.desk.integration.ILyshraOpenDeskActionProviderPlugin}.
 */
public interface ILyshraOpenDeskActionProviderPlugin {
    ILyshraOpenDeskPluginIdentifier getIdentifier();
    List<ILyshraOpenDeskActionProvider> create(ILyshraOpenDeskPluginFacade facade);
}
