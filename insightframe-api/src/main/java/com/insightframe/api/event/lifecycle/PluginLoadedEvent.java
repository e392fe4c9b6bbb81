package com.insightframe.api.event.lifecycle;

/**
 * 加载完成事件，插件能力已进入索引
 */
public class PluginLoadedEvent extends PluginLifecycleEvent {
    public PluginLoadedEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
