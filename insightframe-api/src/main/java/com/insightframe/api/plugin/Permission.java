package com.insightframe.api.plugin;

import java.util.Locale;

/**
 * 插件权限枚举
 * 对应 plugin.yml 中 permissions 列表的取值 (kebab-case)
 */
public enum Permission {
    READ_EXPERIENCES("read-experiences"),
    WRITE_EXPERIENCES("write-experiences"),
    READ_SUBSTANCES("read-substances"),
    NETWORK_ACCESS("network-access"),
    FILE_SYSTEM_ACCESS("file-system-access"),
    BIOMETRIC_DATA("biometric-data"),
    EXPORT_DATA("export-data"),
    IMPORT_DATA("import-data"),
    SEND_NOTIFICATIONS("send-notifications"),
    ANALYTICS_ACCESS("analytics-access");

    private final String key;

    Permission(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    /**
     * 解析权限标识，同时接受 kebab-case 键和枚举常量名 (不区分大小写)
     *
     * @param value 权限标识
     * @return 对应的权限
     * @throws IllegalArgumentException 未知权限
     */
    public static Permission fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Permission cannot be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Permission permission : values()) {
            if (permission.key.equals(normalized)) {
                return permission;
            }
        }
        throw new IllegalArgumentException("Unknown permission: " + value);
    }
}
