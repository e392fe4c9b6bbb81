package com.insightframe.core.testing;

import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.context.PluginContext;
import com.insightframe.api.plugin.InsightPlugin;

import java.util.List;

/**
 * initialize 阻塞 10 秒，用于触发加载超时
 */
public class SlowInitPlugin implements InsightPlugin {

    @Override
    public void initialize(PluginContext context) throws InterruptedException {
        Thread.sleep(10_000);
    }

    @Override
    public List<PluginCapability> getCapabilities() {
        return List.of();
    }
}
