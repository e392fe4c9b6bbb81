package com.insightframe.runtime;

import com.insightframe.core.classloader.DefaultPluginLoaderFactory;
import com.insightframe.core.config.InsightFrameConfig;
import com.insightframe.core.event.EventBus;
import com.insightframe.core.exception.PluginException;
import com.insightframe.core.host.InMemoryPreferenceStore;
import com.insightframe.core.host.InMemoryRecordRepository;
import com.insightframe.core.host.LoggingNotificationChannel;
import com.insightframe.core.loader.PluginDiscoveryService;
import com.insightframe.core.loader.PluginStore;
import com.insightframe.core.plugin.PluginManager;
import com.insightframe.core.security.DefaultPermissionService;
import com.insightframe.core.spi.PreferenceStore;
import com.insightframe.core.spi.RecordRepository;
import com.insightframe.plugin.pattern.PatternRecognitionPlugin;
import com.insightframe.runtime.config.InsightFrameConfigLoader;
import com.insightframe.runtime.host.PropertiesPreferenceStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Paths;

/**
 * InsightFrame Native 启动器
 * 宿主应用通过此类一键启动框架
 */
@Slf4j
public class NativeInsightFrame {

    private static final Object LOCK = new Object();
    private static PluginManager GLOBAL_PLUGIN_MANAGER;
    private static Thread SHUTDOWN_HOOK;

    private NativeInsightFrame() {
    }

    /**
     * 启动 InsightFrame (读取类路径上的 insightframe.yml，不存在时使用默认配置)
     */
    public static PluginManager start() {
        return start(InsightFrameConfigLoader.loadFromClasspath());
    }

    /**
     * 启动 InsightFrame (自定义配置，内存记录存储)
     */
    public static PluginManager start(InsightFrameConfig config) {
        return start(config, new InMemoryRecordRepository());
    }

    /**
     * 启动 InsightFrame
     *
     * @param recordRepository 宿主的记录存储
     */
    public static PluginManager start(InsightFrameConfig config, RecordRepository recordRepository) {
        synchronized (LOCK) {
            if (GLOBAL_PLUGIN_MANAGER != null) {
                log.warn("InsightFrame is already started.");
                return GLOBAL_PLUGIN_MANAGER;
            }

            long start = System.currentTimeMillis();
            log.info("Starting InsightFrame Native Runtime...");
            InsightFrameConfig.init(config);

            // 准备基础设施
            EventBus eventBus = new EventBus();
            DefaultPermissionService permissionService = new DefaultPermissionService(config.isEnforcePermissions());
            PluginStore store = new PluginStore(Paths.get(config.getPluginHome()));
            PreferenceStore preferenceStore = createPreferenceStore(config);

            // 组装 PluginManager
            PluginManager pluginManager = new PluginManager(
                    config,
                    store,
                    new DefaultPluginLoaderFactory(),
                    permissionService,
                    preferenceStore,
                    recordRepository,
                    new LoggingNotificationChannel(),
                    eventBus
            );

            // 内置插件走静态链接路径
            try {
                pluginManager.registerBuiltin(PatternRecognitionPlugin.MANIFEST, new PatternRecognitionPlugin());
            } catch (PluginException e) {
                log.error("Failed to register builtin plugin {}: {}", PatternRecognitionPlugin.ID, e.getMessage(), e);
            }

            // 自动扫描插件仓库
            log.info("Executing initial plugin scan...");
            new PluginDiscoveryService(config, pluginManager).scanAndLoad();

            // 注册关闭钩子
            SHUTDOWN_HOOK = new Thread(() -> {
                log.info("InsightFrame shutting down...");
                pluginManager.shutdown();
            }, "insightframe-shutdown");
            Runtime.getRuntime().addShutdownHook(SHUTDOWN_HOOK);

            GLOBAL_PLUGIN_MANAGER = pluginManager;
            log.info("InsightFrame Native started in {} ms", System.currentTimeMillis() - start);
            return pluginManager;
        }
    }

    /**
     * 获取已启动的管理器
     */
    public static PluginManager getPluginManager() {
        synchronized (LOCK) {
            if (GLOBAL_PLUGIN_MANAGER == null) {
                throw new IllegalStateException("InsightFrame not started");
            }
            return GLOBAL_PLUGIN_MANAGER;
        }
    }

    /**
     * 主动关闭 (不等 JVM 退出)
     */
    public static void stop() {
        synchronized (LOCK) {
            if (GLOBAL_PLUGIN_MANAGER == null) {
                return;
            }
            GLOBAL_PLUGIN_MANAGER.shutdown();
            try {
                Runtime.getRuntime().removeShutdownHook(SHUTDOWN_HOOK);
            } catch (IllegalStateException e) {
                log.debug("JVM already shutting down, hook stays registered");
            }
            GLOBAL_PLUGIN_MANAGER = null;
            SHUTDOWN_HOOK = null;
            InsightFrameConfig.clear();
        }
    }

    private static PreferenceStore createPreferenceStore(InsightFrameConfig config) {
        String file = config.getPreferencesFile();
        if (file == null || file.isBlank()) {
            return new InMemoryPreferenceStore();
        }
        return new PropertiesPreferenceStore(Paths.get(file));
    }
}
