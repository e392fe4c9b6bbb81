package com.insightframe.core.context;

import com.insightframe.api.context.NotificationSeverity;
import com.insightframe.api.context.PluginContext;
import com.insightframe.api.context.PluginNotifications;
import com.insightframe.api.context.PluginPreferences;
import com.insightframe.api.context.RecordAccess;
import com.insightframe.api.event.InsightEvent;
import com.insightframe.api.exception.PermissionDeniedException;
import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Substance;
import com.insightframe.api.plugin.Permission;
import com.insightframe.api.plugin.PluginManifest;
import com.insightframe.core.event.EventBus;
import com.insightframe.core.security.PermissionService;
import com.insightframe.core.spi.NotificationChannel;
import com.insightframe.core.spi.PreferenceStore;
import com.insightframe.core.spi.RecordRepository;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 插件上下文实现
 * <p>
 * 每个插件实例一份。宿主资源只以窄接口暴露，
 * 每次调用先按清单权限鉴权并审计，再委托给宿主 SPI。
 */
@Slf4j
public class CorePluginContext implements PluginContext {

    public static final String PREFERENCE_PREFIX = "plugin_pref_";

    private final PluginManifest manifest;
    private final PermissionService permissionService;
    private final EventBus eventBus;

    private final RecordAccess records;
    private final PluginNotifications notifications;
    private final PluginPreferences preferences;

    public CorePluginContext(PluginManifest manifest,
                             PermissionService permissionService,
                             RecordRepository recordRepository,
                             NotificationChannel notificationChannel,
                             PreferenceStore preferenceStore,
                             EventBus eventBus) {
        this.manifest = manifest;
        this.permissionService = permissionService;
        this.eventBus = eventBus;
        this.records = new ScopedRecordAccess(recordRepository);
        this.notifications = new ScopedNotifications(notificationChannel);
        this.preferences = new ScopedPreferences(preferenceStore, preferenceKeyPrefix(manifest.id()));
    }

    /**
     * 插件私有偏好键前缀：{@code plugin_pref_<pluginId>_}
     */
    public static String preferenceKeyPrefix(String pluginId) {
        return PREFERENCE_PREFIX + pluginId + "_";
    }

    @Override
    public String getPluginId() {
        return manifest.id();
    }

    @Override
    public PluginManifest getManifest() {
        return manifest;
    }

    @Override
    public RecordAccess records() {
        return records;
    }

    @Override
    public PluginNotifications notifications() {
        return notifications;
    }

    @Override
    public PluginPreferences preferences() {
        return preferences;
    }

    @Override
    public boolean hasPermission(Permission permission) {
        return permissionService.isAllowed(manifest.id(), permission);
    }

    @Override
    public void publishEvent(InsightEvent event) {
        log.debug("Event published from {}: {}", manifest.id(), event);
        eventBus.publish(event);
    }

    private void require(Permission permission, String operation) {
        boolean allowed = permissionService.isAllowed(manifest.id(), permission);
        permissionService.audit(manifest.id(), permission, operation, allowed);
        if (!allowed) {
            throw new PermissionDeniedException(manifest.id(), permission);
        }
    }

    private class ScopedRecordAccess implements RecordAccess {

        private final RecordRepository repository;

        ScopedRecordAccess(RecordRepository repository) {
            this.repository = repository;
        }

        @Override
        public List<Experience> readExperiences() {
            require(Permission.READ_EXPERIENCES, "readExperiences");
            return repository.findAllExperiences();
        }

        @Override
        public List<Substance> readSubstances() {
            require(Permission.READ_SUBSTANCES, "readSubstances");
            return repository.findAllSubstances();
        }

        @Override
        public void saveExperience(Experience experience) {
            require(Permission.WRITE_EXPERIENCES, "saveExperience");
            repository.saveExperience(experience);
        }
    }

    private class ScopedNotifications implements PluginNotifications {

        private final NotificationChannel channel;

        ScopedNotifications(NotificationChannel channel) {
            this.channel = channel;
        }

        @Override
        public void show(String title, String message, NotificationSeverity severity) {
            require(Permission.SEND_NOTIFICATIONS, "showNotification");
            channel.notify(manifest.id(), title, message, severity == null ? NotificationSeverity.INFO : severity);
        }
    }

    private static class ScopedPreferences implements PluginPreferences {

        private final PreferenceStore store;
        private final String prefix;

        ScopedPreferences(PreferenceStore store, String prefix) {
            this.store = store;
            this.prefix = prefix;
        }

        @Override
        public String getString(String key, String defaultValue) {
            return store.getString(prefix + key, defaultValue);
        }

        @Override
        public void setString(String key, String value) {
            store.setString(prefix + key, value);
        }

        @Override
        public boolean getBoolean(String key, boolean defaultValue) {
            return store.getBoolean(prefix + key, defaultValue);
        }

        @Override
        public void setBoolean(String key, boolean value) {
            store.setBoolean(prefix + key, value);
        }
    }
}
