package com.insightframe.core.security;

import com.insightframe.api.plugin.Permission;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 默认权限服务实现
 * 职责：保存清单授予的权限，提供鉴权查询，记录审计日志
 */
@Slf4j
public class DefaultPermissionService implements PermissionService {

    // Map<PluginId, 已授予权限>
    private final Map<String, Set<Permission>> permissions = new ConcurrentHashMap<>();

    // false 时只审计不拦截
    private final boolean enforce;

    public DefaultPermissionService() {
        this(true);
    }

    public DefaultPermissionService(boolean enforce) {
        this.enforce = enforce;
    }

    @Override
    public void grant(String pluginId, Set<Permission> granted) {
        Set<Permission> copy = granted == null || granted.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(granted));
        permissions.put(pluginId, copy);
    }

    @Override
    public boolean isAllowed(String pluginId, Permission permission) {
        Set<Permission> granted = permissions.get(pluginId);
        boolean allowed = granted != null && granted.contains(permission);
        if (!allowed && !enforce) {
            log.warn("Permission [{}] not declared by plugin [{}], allowed because enforcement is off",
                    permission.getKey(), pluginId);
            return true;
        }
        return allowed;
    }

    @Override
    public void audit(String pluginId, Permission permission, String operation, boolean allowed) {
        if (!allowed) {
            log.warn("[AUDIT] Plugin: {}, Permission: {}, Op: {}, Allowed: {}", pluginId, permission.getKey(), operation, false);
        } else {
            log.debug("[AUDIT] Plugin: {}, Permission: {}, Op: {}, Allowed: {}", pluginId, permission.getKey(), operation, true);
        }
    }

    @Override
    public void removePlugin(String pluginId) {
        permissions.remove(pluginId);
    }
}
