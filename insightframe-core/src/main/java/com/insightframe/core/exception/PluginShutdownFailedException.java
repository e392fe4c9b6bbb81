package com.insightframe.core.exception;

/**
 * 插件 shutdown 抛出异常或超时，实例已被移除
 */
public class PluginShutdownFailedException extends PluginException {

    public PluginShutdownFailedException(String pluginId, Throwable cause) {
        super(pluginId, "Plugin failed to shut down cleanly [" + pluginId + "]: " + cause.getMessage(), cause);
    }
}
