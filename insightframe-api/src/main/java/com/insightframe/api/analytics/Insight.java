package com.insightframe.api.analytics;

import java.util.Map;

/**
 * 分析得到的观察结论
 *
 * @param confidence 置信度，构造时截断到 [0,1]
 */
public record Insight(String id,
                      String title,
                      String description,
                      double confidence,
                      InsightSeverity severity,
                      Map<String, Object> metadata) {

    public Insight {
        if (Double.isNaN(confidence)) {
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public Insight(String id, String title, String description, double confidence, InsightSeverity severity) {
        this(id, title, description, confidence, severity, Map.of());
    }
}
