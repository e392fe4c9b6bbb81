package com.insightframe.core.spi;

import java.nio.file.Path;

/**
 * 插件类加载器工厂 SPI
 */
public interface PluginLoaderFactory {
    ClassLoader create(String pluginId, Path source, ClassLoader parent);
}
