package com.insightframe.api.context;

import com.insightframe.api.event.InsightEvent;
import com.insightframe.api.plugin.Permission;
import com.insightframe.api.plugin.PluginManifest;

/**
 * 插件上下文
 * 提供插件运行时的环境信息和受控的宿主能力入口
 * <p>
 * 遵循零信任原则，插件只能通过这里拿到的窄接口访问记录、通知和偏好，
 * 每次调用都会按清单中声明的权限进行校验。
 * </p>
 */
public interface PluginContext {

    /**
     * 获取当前插件的唯一标识
     * @return 插件ID
     */
    String getPluginId();

    /**
     * 获取当前插件的清单
     */
    PluginManifest getManifest();

    /**
     * 记录访问 (需要 read-experiences / read-substances / write-experiences)
     */
    RecordAccess records();

    /**
     * 通知通道 (需要 send-notifications)
     */
    PluginNotifications notifications();

    /**
     * 插件私有偏好，键空间按插件隔离，无需额外权限
     */
    PluginPreferences preferences();

    /**
     * 当前插件是否被授予某项权限
     */
    boolean hasPermission(Permission permission);

    /**
     * 发布事件
     * @param event 事件对象
     */
    void publishEvent(InsightEvent event);
}
