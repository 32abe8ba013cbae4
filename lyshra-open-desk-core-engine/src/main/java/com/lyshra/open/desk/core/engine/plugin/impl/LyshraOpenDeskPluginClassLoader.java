package com.lyshra.open.desk.core.engine.plugin.impl;

import java.net.URL;
import java.net.URLClassLoader;

/**
 * Child-first class loader for plugin jars. JDK and contract classes always come from the parent
 * so plugins and engine share one copy of the contract types.
 */
public final class LyshraOpenDeskPluginClassLoader extends URLClassLoader {

    private static final String CONTRACT_PACKAGE = "com.lyshra.open.desk.integration.";

    public LyshraOpenDeskPluginClassLoader(URL[] urls, ClassLoader parent) {
        super(urls, parent);
    }

    @Override
    protected Class<?> loadClass(String name, boolean resolve) throws ClassNotFoundException {
        if (name.startsWith("java.") || name.startsWith(CONTRACT_PACKAGE)) {
            return super.loadClass(name, resolve);
        }
        synchronized (getClassLoadingLock(name)) {
            Class<?> clazz = findLoadedClass(name);
            if (clazz == null && findResource(name.replace('.', '/') + ".class") != null) {
                clazz = findClass(name);
            }
            if (clazz == null) {
                return super.loadClass(name, resolve);
            }
            if (resolve) {
                resolveClass(clazz);
            }
            return clazz;
        }
    }
}
