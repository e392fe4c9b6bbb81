package com.insightframe.api.event.lifecycle;

import com.insightframe.api.event.AbstractInsightEvent;
import lombok.Getter;

/**
 * 插件生命周期事件基类
 */
@Getter
public abstract class PluginLifecycleEvent extends AbstractInsightEvent {
    private final String pluginId;
    private final String version;

    protected PluginLifecycleEvent(String pluginId, String version) {
        super();
        this.pluginId = pluginId;
        this.version = version;
    }

    @Override
    public String toString() {
        return super.toString() + " source=" + pluginId + ":" + version;
    }
}
