package com.insightframe.core.exception;

/**
 * 插件当前未加载
 */
public class NotLoadedException extends PluginException {

    public NotLoadedException(String pluginId) {
        super(pluginId, "Plugin not loaded: " + pluginId);
    }
}
