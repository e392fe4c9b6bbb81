package com.insightframe.api.plugin;

import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.context.PluginContext;

import java.util.List;

/**
 * 插件生命周期接口
 * 所有插件的主入口类必须实现此接口，并提供 public 无参构造器
 */
public interface InsightPlugin {

    /**
     * 插件加载时调用
     * 抛出的任何异常都会导致加载失败
     *
     * @param context 插件上下文，提供受权限约束的宿主能力
     */
    void initialize(PluginContext context) throws Exception;

    /**
     * 插件卸载时调用，用于释放资源
     */
    default void shutdown() throws Exception {
        // Default empty implementation
    }

    /**
     * 插件对外暴露的能力列表
     * 在 initialize 成功后由宿主读取并建立索引
     */
    List<PluginCapability> getCapabilities();
}
