package com.insightframe.api.event.lifecycle;

/**
 * 卸载完成事件，插件包与目录条目均已移除
 */
public class PluginUninstalledEvent extends PluginLifecycleEvent {
    public PluginUninstalledEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
