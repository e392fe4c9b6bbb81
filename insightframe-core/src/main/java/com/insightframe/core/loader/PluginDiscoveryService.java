package com.insightframe.core.loader;

import com.insightframe.core.config.InsightFrameConfig;
import com.insightframe.core.plugin.PluginManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 插件自动发现服务
 * <p>
 * 启动时扫描插件仓库，把未登记的插件包加入目录并自动加载之前启用的插件。
 * 坏插件只记录日志和 lastError，不会阻断宿主启动。
 */
@Slf4j
@RequiredArgsConstructor
public class PluginDiscoveryService {

    private final InsightFrameConfig config;
    private final PluginManager pluginManager;

    /**
     * 执行扫描并加载
     *
     * @return 新登记的插件数
     */
    public int scanAndLoad() {
        if (!config.isAutoScan()) {
            log.info("Auto scan disabled, skipping plugin store {}", config.getPluginHome());
            return 0;
        }
        log.info("Starting plugin discovery from {}", config.getPluginHome());
        int registered = pluginManager.scanStore();
        log.info("Plugin discovery finished. Registered: {}, loaded: {}",
                registered, pluginManager.getLoadedPlugins().size());
        return registered;
    }
}
