package com.insightframe.api.analytics;

public enum RecommendationPriority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
