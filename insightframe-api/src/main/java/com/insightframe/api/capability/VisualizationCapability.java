package com.insightframe.api.capability;

import com.insightframe.api.visualization.RenderedVisualization;
import com.insightframe.api.visualization.VisualizationContext;

/**
 * 可视化能力
 */
public record VisualizationCapability(String id, String name, String description, Renderer renderer)
        implements PluginCapability {

    @Override
    public CapabilityKind kind() {
        return CapabilityKind.VISUALIZATION;
    }

    public RenderedVisualization render(VisualizationContext context) throws Exception {
        return renderer.render(context);
    }

    @FunctionalInterface
    public interface Renderer {
        RenderedVisualization render(VisualizationContext context) throws Exception;
    }
}
