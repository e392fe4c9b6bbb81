package com.insightframe.api.event.lifecycle;

/**
 * 卸载实例事件，插件能力已从索引移除
 */
public class PluginUnloadedEvent extends PluginLifecycleEvent {
    public PluginUnloadedEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
