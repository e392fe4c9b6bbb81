package com.insightframe.api.visualization;

import com.insightframe.api.analytics.VisualizationData;

public record VisualizationContext(VisualizationData data, boolean interactive, boolean exportable) {

    public VisualizationContext(VisualizationData data) {
        this(data, true, true);
    }
}
