package com.insightframe.api.analytics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 一次分析的输出
 *
 * @param riskAssessment 可为空
 */
public record AnalyticsResult(List<Insight> insights,
                              List<Recommendation> recommendations,
                              RiskAssessment riskAssessment,
                              List<VisualizationData> visualizations) {

    private static final AnalyticsResult EMPTY = new AnalyticsResult(List.of(), List.of(), null, List.of());

    public AnalyticsResult {
        insights = insights == null ? List.of() : List.copyOf(insights);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        visualizations = visualizations == null ? List.of() : List.copyOf(visualizations);
    }

    public AnalyticsResult(List<Insight> insights, List<Recommendation> recommendations) {
        this(insights, recommendations, null, List.of());
    }

    public static AnalyticsResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return insights.isEmpty() && recommendations.isEmpty() && riskAssessment == null && visualizations.isEmpty();
    }

    /**
     * 合并多个结果：列表按顺序拼接，风险评估取第一个非空值
     */
    public static AnalyticsResult merge(Collection<AnalyticsResult> results) {
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        List<VisualizationData> visualizations = new ArrayList<>();
        RiskAssessment risk = null;
        for (AnalyticsResult result : results) {
            insights.addAll(result.insights());
            recommendations.addAll(result.recommendations());
            visualizations.addAll(result.visualizations());
            if (risk == null) {
                risk = result.riskAssessment();
            }
        }
        return new AnalyticsResult(insights, recommendations, risk, visualizations);
    }
}
