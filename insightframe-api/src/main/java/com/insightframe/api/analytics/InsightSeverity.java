package com.insightframe.api.analytics;

public enum InsightSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
