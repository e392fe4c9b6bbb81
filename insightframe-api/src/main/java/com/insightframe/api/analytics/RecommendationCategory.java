package com.insightframe.api.analytics;

public enum RecommendationCategory {
    SAFETY,
    OPTIMIZATION,
    HEALTH,
    INTEGRATION,
    TIMING
}
