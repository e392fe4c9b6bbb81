package com.insightframe.core.exception;

/**
 * 目录中不存在该插件
 */
public class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String pluginId) {
        super(pluginId, "Plugin not found: " + pluginId);
    }
}
