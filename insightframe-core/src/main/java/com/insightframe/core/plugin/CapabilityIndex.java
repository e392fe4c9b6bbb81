package com.insightframe.core.plugin;

import com.insightframe.api.capability.AnalyticsCapability;
import com.insightframe.api.capability.CapabilityKind;
import com.insightframe.api.capability.ConversationalCapability;
import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.capability.VisualizationCapability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 按种类分组的能力索引 (不可变快照)
 * 每次加载/卸载后整体重建，读方无需加锁
 */
public final class CapabilityIndex {

    public static final CapabilityIndex EMPTY = new CapabilityIndex(List.of(), List.of(), List.of());

    private final List<Entry<AnalyticsCapability>> analytics;
    private final List<Entry<VisualizationCapability>> visualization;
    private final List<Entry<ConversationalCapability>> conversational;

    private CapabilityIndex(List<Entry<AnalyticsCapability>> analytics,
                            List<Entry<VisualizationCapability>> visualization,
                            List<Entry<ConversationalCapability>> conversational) {
        this.analytics = List.copyOf(analytics);
        this.visualization = List.copyOf(visualization);
        this.conversational = List.copyOf(conversational);
    }

    /**
     * 按插件加载顺序构建索引
     */
    public static CapabilityIndex build(Collection<LoadedPlugin> plugins) {
        List<Entry<AnalyticsCapability>> analytics = new ArrayList<>();
        List<Entry<VisualizationCapability>> visualization = new ArrayList<>();
        List<Entry<ConversationalCapability>> conversational = new ArrayList<>();
        for (LoadedPlugin loaded : plugins) {
            for (PluginCapability capability : loaded.capabilities()) {
                if (capability == null) {
                    continue;
                }
                switch (capability.kind()) {
                    case ANALYTICS -> analytics.add(new Entry<>(loaded.id(), (AnalyticsCapability) capability));
                    case VISUALIZATION -> visualization.add(new Entry<>(loaded.id(), (VisualizationCapability) capability));
                    case CONVERSATIONAL -> conversational.add(new Entry<>(loaded.id(), (ConversationalCapability) capability));
                }
            }
        }
        return new CapabilityIndex(analytics, visualization, conversational);
    }

    public List<Entry<AnalyticsCapability>> analytics() {
        return analytics;
    }

    public List<Entry<VisualizationCapability>> visualization() {
        return visualization;
    }

    public List<Entry<ConversationalCapability>> conversational() {
        return conversational;
    }

    public List<PluginCapability> of(CapabilityKind kind) {
        List<? extends Entry<? extends PluginCapability>> entries = switch (kind) {
            case ANALYTICS -> analytics;
            case VISUALIZATION -> visualization;
            case CONVERSATIONAL -> conversational;
        };
        List<PluginCapability> result = new ArrayList<>(entries.size());
        for (Entry<? extends PluginCapability> entry : entries) {
            result.add(entry.capability());
        }
        return List.copyOf(result);
    }

    public int size() {
        return analytics.size() + visualization.size() + conversational.size();
    }

    /**
     * 能力及其所属插件
     */
    public record Entry<C extends PluginCapability>(String pluginId, C capability) {
    }
}
