package com.insightframe.api.analytics;

/**
 * 风险等级，阈值 0.4 / 0.7
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel of(double risk) {
        if (risk >= 0.7) {
            return HIGH;
        }
        if (risk >= 0.4) {
            return MEDIUM;
        }
        return LOW;
    }
}
