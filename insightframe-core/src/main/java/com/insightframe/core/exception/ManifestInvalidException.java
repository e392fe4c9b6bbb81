package com.insightframe.core.exception;

/**
 * 清单缺少必填字段或格式错误
 */
public class ManifestInvalidException extends PluginException {

    public ManifestInvalidException(String source, String reason) {
        super(source, "Invalid plugin manifest [" + source + "]: " + reason);
    }

    public ManifestInvalidException(String source, String reason, Throwable cause) {
        super(source, "Invalid plugin manifest [" + source + "]: " + reason, cause);
    }
}
