package com.insightframe.core.exception;

/**
 * 插件仓库读写失败
 */
public class StoreWriteFailedException extends PluginException {

    public StoreWriteFailedException(String pluginId, String operation, Throwable cause) {
        super(pluginId, "Plugin store " + operation + " failed for [" + pluginId + "]: " + cause.getMessage(), cause);
    }
}
