package com.insightframe.api.analytics;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 图表载荷
 * data 为通用键值映射，具体结构由图表类型约定
 */
public record VisualizationData(VisualizationType type, Map<String, Object> data, String title, String description) {

    public VisualizationData {
        // 允许 null 值，因此不使用 Map.copyOf
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
