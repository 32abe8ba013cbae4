package com.lyshra.open.desk.core.engine.plugin.impl;

import com.lyshra.open.desk.core.engine.plugin.ILyshraOpenDeskPluginLoader;
import com.lyshra.open.desk.core.engine.plugin.LyshraOpenDeskPluginDescriptor;
import com.lyshra.open.desk.core.exception.LyshraOpenDeskRuntimeException;
import com.lyshra.open.desk.integration.ILyshraOpenDeskActionProviderPlugin;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginFacade;
import com.lyshra.open.desk.integration.contract.ILyshraOpenDeskPluginIdentifier;
import com.lyshra.open.desk.integration.contract.action.ILyshraOpenDeskActionProvider;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URL;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Discovers {@link ILyshraOpenDeskActionProviderPlugin} implementations with {@link ServiceLoader}.
 * A plugin that fails to load or to create its providers is logged and skipped.
 */
@Slf4j
public final class LyshraOpenDeskPluginLoader implements ILyshraOpenDeskPluginLoader {

    private final ILyshraOpenDeskPluginFacade facade;
    private final ClassLoader parentClassLoader;
    private final Map<String, LyshraOpenDeskPluginDescriptor> loadedPlugins = new LinkedHashMap<>();

    public LyshraOpenDeskPluginLoader(ILyshraOpenDeskPluginFacade facade) {
        this(facade, LyshraOpenDeskPluginLoader.class.getClassLoader());
    }

    public LyshraOpenDeskPluginLoader(ILyshraOpenDeskPluginFacade facade, ClassLoader parentClassLoader) {
        this.facade = Objects.requireNonNull(facade, "facade");
        this.parentClassLoader = parentClassLoader;
    }

    @Override
    public synchronized List<ILyshraOpenDeskActionProvider> loadClasspathPlugins() {
        return loadFrom(ServiceLoader.load(ILyshraOpenDeskActionProviderPlugin.class, parentClassLoader),
                parentClassLoader, Paths.get("."));
    }

    @Override
    public synchronized List<ILyshraOpenDeskActionProvider> loadAllPlugins(Path pluginsRootDirectory) {
        if (!Files.isDirectory(pluginsRootDirectory)) {
            throw new IllegalStateException("Plugins directory Not Found: " + pluginsRootDirectory);
        }
        List<ILyshraOpenDeskActionProvider> providers = new ArrayList<>();
        try (DirectoryStream<Path> dirs = Files.newDirectoryStream(pluginsRootDirectory)) {
            for (Path pluginDir : dirs) {
                if (Files.isDirectory(pluginDir)) {
                    providers.addAll(loadPluginDirectory(pluginDir));
                }
            }
        } catch (IOException e) {
            throw new LyshraOpenDeskRuntimeException("Failed to scan plugins", e);
        }
        return providers;
    }

    @Override
    public synchronized List<ILyshraOpenDeskActionProvider> loadPlugin(ILyshraOpenDeskActionProviderPlugin plugin) {
        return register(plugin, parentClassLoader, Paths.get("."));
    }

    @Override
    public synchronized List<LyshraOpenDeskPluginDescriptor> getLoadedPlugins() {
        return List.copyOf(loadedPlugins.values());
    }

    private List<ILyshraOpenDeskActionProvider> loadPluginDirectory(Path pluginDir) {
        try {
            URL[] jarUrls = getJars(pluginDir);
            if (jarUrls.length == 0) {
                return List.of();
            }
            LyshraOpenDeskPluginClassLoader classLoader = new LyshraOpenDeskPluginClassLoader(jarUrls, parentClassLoader);
            return loadFrom(ServiceLoader.load(ILyshraOpenDeskActionProviderPlugin.class, classLoader), classLoader, pluginDir);
        } catch (IOException e) {
            log.error("Failed to load plugin from directory: [{}]", pluginDir.toAbsolutePath(), e);
            return List.of();
        }
    }

    private List<ILyshraOpenDeskActionProvider> loadFrom(
            ServiceLoader<ILyshraOpenDeskActionProviderPlugin> serviceLoader,
            ClassLoader classLoader,
            Path pluginDir) {

        List<ILyshraOpenDeskActionProvider> providers = new ArrayList<>();
        Iterator<ILyshraOpenDeskActionProviderPlugin> plugins = serviceLoader.iterator();
        while (true) {
            ILyshraOpenDeskActionProviderPlugin plugin;
            try {
                if (!plugins.hasNext()) {
                    break;
                }
                plugin = plugins.next();
            } catch (ServiceConfigurationError e) {
                log.error("Failed to instantiate plugin from: [{}]", pluginDir.toAbsolutePath(), e);
                continue;
            }
            providers.addAll(register(plugin, classLoader, pluginDir));
        }
        return providers;
    }

    private List<ILyshraOpenDeskActionProvider> register(
            ILyshraOpenDeskActionProviderPlugin plugin,
            ClassLoader classLoader,
            Path pluginDir) {

        try {
            ILyshraOpenDeskPluginIdentifier identifier = plugin.getIdentifier();
            String key = identifier.toString();
            if (loadedPlugins.containsKey(key)) {
                log.warn("Plugin already registered: [{}]", identifier);
                return List.of();
            }
            List<ILyshraOpenDeskActionProvider> providers = plugin.create(facade).stream()
                    .filter(Objects::nonNull)
                    .toList();
            loadedPlugins.put(key, new LyshraOpenDeskPluginDescriptor(pluginDir, classLoader, plugin, providers));
            log.info("Loaded plugin: [{}] with [{}] action providers", identifier, providers.size());
            return providers;
        } catch (RuntimeException e) {
            log.error("Failed to create plugin: [{}]", plugin.getClass().getName(), e);
            return List.of();
        }
    }

    private URL[] getJars(Path pluginDir) throws IOException {
        try (Stream<Path> list = Files.walk(pluginDir)) {
            List<Path> jarPathList = list
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".jar")).toList();
            URL[] jarUrls = new URL[jarPathList.size()];
            for (int i = 0; i < jarPathList.size(); i++) {
                jarUrls[i] = jarPathList.get(i).toUri().toURL();
            }
            return jarUrls;
        }
    }
}
