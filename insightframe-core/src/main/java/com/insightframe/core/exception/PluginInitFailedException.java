package com.insightframe.core.exception;

/**
 * 插件入口无法解析或 initialize 抛出异常
 */
public class PluginInitFailedException extends PluginException {

    public PluginInitFailedException(String pluginId, Throwable cause) {
        super(pluginId, "Plugin failed to load [" + pluginId + "]: " + describe(cause), cause);
    }

    public PluginInitFailedException(String pluginId, String reason) {
        super(pluginId, "Plugin failed to load [" + pluginId + "]: " + reason);
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
