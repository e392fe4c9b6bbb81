package com.insightframe.api.analytics;

/**
 * 单个风险因子
 *
 * @param factor      因子名称
 * @param severity    因子自身严重度 [0,1]
 * @param description 描述
 */
public record RiskFactor(String factor, double severity, String description) {
}
