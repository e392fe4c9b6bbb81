package com.insightframe.core.plugin;

import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.plugin.InsightPlugin;
import com.insightframe.api.plugin.PluginManifest;

import java.util.List;

/**
 * 驻留内存的插件实例
 *
 * @param classLoader 插件包的类加载器；内置插件为 null
 * @param capabilities initialize 成功后读取的能力快照
 */
public record LoadedPlugin(PluginManifest manifest,
                           InsightPlugin plugin,
                           ClassLoader classLoader,
                           List<PluginCapability> capabilities) {

    public LoadedPlugin {
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }

    public String id() {
        return manifest.id();
    }

    public boolean isBuiltin() {
        return classLoader == null;
    }
}
