package com.insightframe.api.analytics;

/**
 * 可执行建议
 */
public record Recommendation(String id,
                             String title,
                             String description,
                             boolean actionable,
                             RecommendationPriority priority,
                             RecommendationCategory category) {
}
