package com.insightframe.core.classloader;

import com.insightframe.core.exception.PluginInitFailedException;
import com.insightframe.core.spi.PluginLoaderFactory;

import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Path;

public class DefaultPluginLoaderFactory implements PluginLoaderFactory {

    @Override
    public ClassLoader create(String pluginId, Path source, ClassLoader parent) {
        try {
            // 默认实现：每个插件包一个 Child-First 加载器
            return new PluginClassLoader(pluginId, new URL[]{source.toUri().toURL()}, parent);
        } catch (MalformedURLException e) {
            throw new PluginInitFailedException(pluginId, e);
        }
    }
}
