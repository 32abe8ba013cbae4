package com.lyshra.open.desk.core.engine.plugin;

import com.lyshra.open.desk.integration.ILyshraOpenDeskActionProviderPlugin;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginIdentifier;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

@Data
public class LyshraOpenDeskPluginDescriptor {
    private final Path pluginDirectory;
    private final ClassLoader classLoader;
    private final ILyshraOpenDeskActionProviderPlugin plugin;
    private final List<ILyshraOpenDeskActionProvider> providers;

    public ILyshraOpenDeskPluginIdentifier getIdentifier() {
        return plugin.getIdentifier();
    }
}
