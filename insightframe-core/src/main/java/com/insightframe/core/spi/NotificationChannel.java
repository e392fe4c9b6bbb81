package com.insightframe.core.spi;

import com.insightframe.api.context.NotificationSeverity;

/**
 * 宿主通知通道 SPI
 */
public interface NotificationChannel {

    void notify(String pluginId, String title, String message, NotificationSeverity severity);
}
