package com.insightframe.api.analytics;

public enum VisualizationType {
    LINE_CHART,
    BAR_CHART,
    SCATTER_PLOT,
    HEAT_MAP,
    NETWORK_GRAPH,
    TIMELINE,
    CALENDAR,
    GAUGE
}
