package com.lyshra.open.desk.core.engine.plugin;

import com.lyshra.open.desk.integration.ILyshraOpenDeskActionProviderPlugin;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;

import java.nio.file.Path;
import java.util.List;

public interface ILyshraOpenDeskPluginLoader {

    /**
     * Providers of every plugin registered in {@code META-INF/services} on the engine class path,
     * in discovery order.
     */
    List<ILyshraOpenDeskActionProvider> loadClasspathPlugins();

    /**
     * Providers of the plugins packaged as jars below each sub directory of the given root.
     */
    List<ILyshraOpenDeskActionProvider> loadAllPlugins(Path pluginsRootDirectory);

    List<ILyshraOpenDeskActionProvider> loadPlugin(ILyshraOpenDeskActionProviderPlugin plugin);

    List<LyshraOpenDeskPluginDescriptor> getLoadedPlugins();
}
