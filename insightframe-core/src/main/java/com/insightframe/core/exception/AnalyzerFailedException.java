package com.insightframe.core.exception;

import lombok.Getter;

/**
 * 单个能力调用失败或超时
 * 仅记录在分发失败日志中，不会抛给分发调用方
 */
@Getter
public class AnalyzerFailedException extends PluginException {

    private final String capabilityId;

    public AnalyzerFailedException(String pluginId, String capabilityId, String reason) {
        super(pluginId, "Capability [" + pluginId + "/" + capabilityId + "] failed: " + reason);
        this.capabilityId = capabilityId;
    }

    public AnalyzerFailedException(String pluginId, String capabilityId, Throwable cause) {
        super(pluginId, "Capability [" + pluginId + "/" + capabilityId + "] failed: " + cause, cause);
        this.capabilityId = capabilityId;
    }
}
