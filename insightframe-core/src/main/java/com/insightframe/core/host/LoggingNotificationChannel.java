package com.insightframe.core.host;

import com.insightframe.api.context.NotificationSeverity;
import com.insightframe.core.spi.NotificationChannel;
import lombok.extern.slf4j.Slf4j;

/**
 * 没有 UI 时的默认通知通道：写日志
 */
@Slf4j
public class LoggingNotificationChannel implements NotificationChannel {

    @Override
    public void notify(String pluginId, String title, String message, NotificationSeverity severity) {
        switch (severity) {
            case ERROR -> log.error("[{}] {}: {}", pluginId, title, message);
            case WARNING -> log.warn("[{}] {}: {}", pluginId, title, message);
            default -> log.info("[{}] {}: {}", pluginId, title, message);
        }
    }
}
