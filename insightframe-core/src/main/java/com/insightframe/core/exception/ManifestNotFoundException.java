package com.insightframe.core.exception;

/**
 * 插件包中缺少 plugin.yml
 */
public class ManifestNotFoundException extends PluginException {

    public ManifestNotFoundException(String source) {
        super(source, "Plugin manifest not found in " + source);
    }

    public ManifestNotFoundException(String source, Throwable cause) {
        super(source, "Plugin manifest not readable in " + source + ": " + cause.getMessage(), cause);
    }
}
