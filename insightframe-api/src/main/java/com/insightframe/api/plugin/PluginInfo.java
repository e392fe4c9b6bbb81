package com.insightframe.api.plugin;

/**
 * 插件运行时视图
 * <p>
 * enabled 为用户持久化的选择，loaded 为当前内存状态，两者相互独立：
 * 插件可以处于已启用但加载失败的状态，此时 lastError 记录失败原因。
 * </p>
 *
 * @param manifest  插件清单
 * @param enabled   是否启用
 * @param loaded    是否已加载
 * @param lastError 最近一次错误，可为空
 */
public record PluginInfo(PluginManifest manifest, boolean enabled, boolean loaded, String lastError) {

    public PluginInfo(PluginManifest manifest, boolean enabled, boolean loaded) {
        this(manifest, enabled, loaded, null);
    }

    public String id() {
        return manifest.id();
    }

    public PluginInfo withEnabled(boolean enabled) {
        return new PluginInfo(manifest, enabled, loaded, lastError);
    }

    /**
     * 加载状态变化会清除旧的错误信息
     */
    public PluginInfo withLoaded(boolean loaded) {
        return new PluginInfo(manifest, enabled, loaded, null);
    }

    public PluginInfo withError(String error) {
        return new PluginInfo(manifest, enabled, false, error);
    }

    public boolean hasError() {
        return lastError != null;
    }
}
