package com.insightframe.api.analytics;

import java.util.List;

/**
 * 综合风险评估
 *
 * @param overallRisk          总体风险，构造时截断到 [0,1]
 * @param riskFactors          参与计算的风险因子
 * @param mitigationStrategies 缓解策略
 */
public record RiskAssessment(double overallRisk, List<RiskFactor> riskFactors, List<String> mitigationStrategies) {

    public RiskAssessment {
        if (Double.isNaN(overallRisk)) {
            overallRisk = 0.0;
        }
        overallRisk = Math.max(0.0, Math.min(1.0, overallRisk));
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
        mitigationStrategies = mitigationStrategies == null ? List.of() : List.copyOf(mitigationStrategies);
    }

    public RiskLevel level() {
        return RiskLevel.of(overallRisk);
    }
}
