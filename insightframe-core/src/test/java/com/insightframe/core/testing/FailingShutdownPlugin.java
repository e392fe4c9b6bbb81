package com.insightframe.core.testing;

import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.context.PluginContext;
import com.insightframe.api.plugin.InsightPlugin;

import java.util.List;

public class FailingShutdownPlugin implements InsightPlugin {

    @Override
    public void initialize(PluginContext context) {
    }

    @Override
    public void shutdown() {
        throw new IllegalStateException("cannot release resources");
    }

    @Override
    public List<PluginCapability> getCapabilities() {
        return List.of();
    }
}
