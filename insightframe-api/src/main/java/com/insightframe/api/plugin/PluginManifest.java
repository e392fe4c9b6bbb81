package com.insightframe.api.plugin;

import lombok.Builder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 对应 plugin.yml 的根节点
 * 插件身份的不可变描述，安装时从插件包中解析，之后不再变化
 *
 * @param id           插件唯一标识
 * @param name         显示名称
 * @param version      语义化版本号
 * @param description  描述
 * @param author       作者
 * @param permissions  申请的权限
 * @param entryPoint   插件入口类全限定名
 * @param dependencies 依赖的插件ID (仅声明，当前版本不做解析)
 */
@Builder(toBuilder = true)
public record PluginManifest(String id,
                             String name,
                             String version,
                             String description,
                             String author,
                             Set<Permission> permissions,
                             String entryPoint,
                             List<String> dependencies) {

    public PluginManifest {
        description = description == null ? "" : description;
        author = author == null ? "" : author;
        if (permissions == null || permissions.isEmpty()) {
            permissions = Collections.emptySet();
        } else {
            permissions = Collections.unmodifiableSet(EnumSet.copyOf(permissions));
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /**
     * 验证必填字段
     *
     * @throws IllegalArgumentException 任一必填字段为空
     */
    public void validate() {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Plugin id cannot be blank");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Plugin name cannot be blank");
        }
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException("Plugin version cannot be blank");
        }
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new IllegalArgumentException("Plugin entry point cannot be blank");
        }
    }

    public boolean requires(Permission permission) {
        return permissions.contains(permission);
    }

    @Override
    public String toString() {
        return String.format("PluginManifest{id='%s', version='%s'}", id, version);
    }
}
