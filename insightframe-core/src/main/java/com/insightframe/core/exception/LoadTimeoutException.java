package com.insightframe.core.exception;

/**
 * 加载或初始化超过配置的时限
 */
public class LoadTimeoutException extends PluginException {

    public LoadTimeoutException(String pluginId, long timeoutMs) {
        super(pluginId, "Plugin [" + pluginId + "] did not finish loading within " + timeoutMs + "ms");
    }
}
