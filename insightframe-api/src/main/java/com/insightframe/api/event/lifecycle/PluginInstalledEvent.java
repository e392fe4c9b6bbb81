package com.insightframe.api.event.lifecycle;

/**
 * 安装完成事件
 */
public class PluginInstalledEvent extends PluginLifecycleEvent {
    public PluginInstalledEvent(String pluginId, String version) {
        super(pluginId, version);
    }
}
