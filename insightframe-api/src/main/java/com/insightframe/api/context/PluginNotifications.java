package com.insightframe.api.context;

/**
 * 插件通知接口
 */
public interface PluginNotifications {

    void show(String title, String message, NotificationSeverity severity);
}
