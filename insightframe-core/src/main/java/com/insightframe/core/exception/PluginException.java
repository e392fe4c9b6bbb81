package com.insightframe.core.exception;

import com.insightframe.api.exception.InsightFrameException;
import lombok.Getter;

/**
 * 插件目录操作异常基类
 * 安装、卸载、加载、启停失败时抛给调用方，消息可直接展示给用户
 */
@Getter
public abstract class PluginException extends InsightFrameException {

    /**
     * 相关插件ID；清单尚未解析时为插件包文件名
     */
    private final String pluginId;

    protected PluginException(String pluginId, String message) {
        super(message);
        this.pluginId = pluginId;
    }

    protected PluginException(String pluginId, String message, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
    }
}
