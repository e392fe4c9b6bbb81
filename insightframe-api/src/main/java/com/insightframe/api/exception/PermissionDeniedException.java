package com.insightframe.api.exception;

import com.insightframe.api.plugin.Permission;
import lombok.Getter;

/**
 * 权限拒绝异常
 * 当插件尝试通过上下文执行清单中未声明的操作时抛出此异常。
 */
@Getter
public class PermissionDeniedException extends InsightFrameException {

    private final String pluginId;
    private final Permission permission;

    public PermissionDeniedException(String pluginId, Permission permission) {
        super("Plugin [" + pluginId + "] lacks permission: " + permission.getKey());
        this.pluginId = pluginId;
        this.permission = permission;
    }
}
