package com.insightframe.core.plugin;

import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.capability.AnalyticsCapability;
import com.insightframe.api.capability.CapabilityKind;
import com.insightframe.api.capability.ConversationalCapability;
import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.capability.VisualizationCapability;
import com.insightframe.api.conversation.ConversationResponse;
import com.insightframe.api.plugin.PluginManifest;
import com.insightframe.api.visualization.RenderedVisualization;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CapabilityIndex 单元测试")
class CapabilityIndexTest {

    private static LoadedPlugin loaded(String id, PluginCapability... capabilities) {
        PluginManifest manifest = PluginManifest.builder()
                .id(id).name(id).version("1.0.0").entryPoint("x." + id).build();
        return new LoadedPlugin(manifest, null, null, Arrays.asList(capabilities));
    }

    @Test
    @DisplayName("按种类分组并保持插件加载顺序")
    void groupsByKindInOrder() {
        AnalyticsCapability a1 = new AnalyticsCapability("a1", "a1", "", ctx -> AnalyticsResult.empty());
        AnalyticsCapability a2 = new AnalyticsCapability("a2", "a2", "", ctx -> AnalyticsResult.empty());
        VisualizationCapability v = new VisualizationCapability("v", "v", "",
                ctx -> new RenderedVisualization(RenderedVisualization.TEXT_PLAIN, ""));
        ConversationalCapability c = new ConversationalCapability("c", "c", "",
                q -> new ConversationResponse("", 0.0));

        CapabilityIndex index = CapabilityIndex.build(List.of(loaded("p1", a1, v), loaded("p2", c, a2)));

        assertEquals(List.of(a1, a2), index.of(CapabilityKind.ANALYTICS));
        assertEquals(List.of(v), index.of(CapabilityKind.VISUALIZATION));
        assertEquals(List.of(c), index.of(CapabilityKind.CONVERSATIONAL));
        assertEquals("p2", index.analytics().get(1).pluginId());
        assertEquals(4, index.size());
    }

    @Test
    @DisplayName("忽略空能力，空索引没有条目")
    void skipsNulls() {
        CapabilityIndex index = CapabilityIndex.build(List.of(loaded("p1", (PluginCapability) null)));

        assertEquals(0, index.size());
        assertEquals(0, CapabilityIndex.EMPTY.size());
        assertTrue(CapabilityIndex.EMPTY.of(CapabilityKind.ANALYTICS).isEmpty());
    }
}
