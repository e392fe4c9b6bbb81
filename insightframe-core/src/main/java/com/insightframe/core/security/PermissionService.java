package com.insightframe.core.security;

import com.insightframe.api.plugin.Permission;

import java.util.Set;

/**
 * Core 提供 - 权限查询服务
 * 负责检查插件是否有某项权限，并记录审计日志。
 */
public interface PermissionService {

    /**
     * 以清单中声明的权限为准授予插件
     */
    void grant(String pluginId, Set<Permission> permissions);

    /**
     * 检查插件是否有某项权限。
     *
     * @param pluginId   插件ID
     * @param permission 权限
     * @return 如果允许访问则返回 true，否则返回 false
     */
    boolean isAllowed(String pluginId, Permission permission);

    /**
     * 记录审计日志。
     *
     * @param pluginId   插件ID
     * @param permission 权限
     * @param operation  具体操作，例如 readExperiences
     * @param allowed    是否允许该操作
     */
    void audit(String pluginId, Permission permission, String operation, boolean allowed);

    /**
     * 清理插件的权限数据
     */
    void removePlugin(String pluginId);
}
