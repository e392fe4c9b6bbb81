package com.insightframe.core.exception;

/**
 * 插件已驻留内存
 */
public class AlreadyLoadedException extends PluginException {

    public AlreadyLoadedException(String pluginId) {
        super(pluginId, "Plugin already loaded: " + pluginId);
    }
}
