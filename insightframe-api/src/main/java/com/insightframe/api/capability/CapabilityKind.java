package com.insightframe.api.capability;

/**
 * 能力种类，宿主按种类分发而不是按运行时类型判断
 */
public enum CapabilityKind {
    ANALYTICS,
    VISUALIZATION,
    CONVERSATIONAL
}
