package com.insightframe.plugin.pattern.analysis;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.analytics.Insight;
import com.insightframe.api.analytics.InsightSeverity;
import com.insightframe.api.analytics.Recommendation;
import com.insightframe.api.analytics.RecommendationCategory;
import com.insightframe.api.analytics.RecommendationPriority;
import com.insightframe.api.analytics.RiskAssessment;
import com.insightframe.api.analytics.RiskFactor;
import com.insightframe.api.analytics.RiskLevel;
import com.insightframe.api.analytics.VisualizationData;
import com.insightframe.api.analytics.VisualizationType;
import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.TimeRange;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 综合风险评估
 * <p>
 * 三个加权因子，总和截断到 [0,1]：
 * <ul>
 *     <li>近 30 天体验次数 (权重 0.3)</li>
 *     <li>最近 5 次体验涉及的物质种数 (权重 0.4)</li>
 *     <li>最近 5 次体验中的差评次数 (权重 0.3)</li>
 * </ul>
 * 参考时间为时间范围的结束时间，未设置范围时取时钟当前时间。
 */
@Slf4j
public class RiskAssessmentAnalyzer implements PatternAnalysis {

    static final Duration RECENT_WINDOW = Duration.ofDays(30);
    static final int RECENT_EXPERIENCES = 5;

    static final double FREQUENCY_WEIGHT = 0.3;
    static final double POLYDRUG_WEIGHT = 0.4;
    static final double NEGATIVE_TREND_WEIGHT = 0.3;

    static final String TAKE_A_BREAK = "Take a break from psychoactive substances";
    static final String FOCUS_ON_ONE = "Focus on one substance type to reduce interaction risks";
    static final String REVIEW_SET_AND_SETTING =
            "Review set and setting factors that may have contributed to negative experiences";

    // 按日期倒序，无日期的排在最后
    private static final Comparator<Experience> MOST_RECENT_FIRST = Comparator.comparing(
            (Experience e) -> e.effectiveDate().orElse(null),
            Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

    private final Clock clock;

    public RiskAssessmentAnalyzer() {
        this(Clock.systemUTC());
    }

    public RiskAssessmentAnalyzer(Clock clock) {
        this.clock = clock;
    }

    @Override
    public AnalyticsResult analyze(AnalyticsContext context) {
        List<Experience> experiences = context.experiencesInRange();
        Instant reference = context.range().map(TimeRange::end).orElseGet(clock::instant);
        Instant windowStart = reference.minus(RECENT_WINDOW);

        List<RiskFactor> factors = new ArrayList<>();
        Map<String, String> mitigations = new LinkedHashMap<>();
        double overall = 0.0;

        // 近期频率
        int recentCount = 0;
        for (Experience experience : experiences) {
            Instant date = experience.effectiveDate().orElse(null);
            if (date != null && !date.isBefore(windowStart) && !date.isAfter(reference)) {
                recentCount++;
            }
        }
        if (recentCount > 3) {
            double severity = Math.min(1.0, recentCount / 10.0);
            factors.add(new RiskFactor("High Recent Activity", severity,
                    recentCount + " experiences in the last 30 days"));
            mitigations.put("frequency", TAKE_A_BREAK);
            overall += severity * FREQUENCY_WEIGHT;
        }

        List<Experience> mostRecent = new ArrayList<>(experiences);
        mostRecent.sort(MOST_RECENT_FIRST);
        if (mostRecent.size() > RECENT_EXPERIENCES) {
            mostRecent = mostRecent.subList(0, RECENT_EXPERIENCES);
        }

        // 多物质混用
        Set<String> recentSubstances = new LinkedHashSet<>();
        for (Experience experience : mostRecent) {
            recentSubstances.addAll(experience.substanceNames());
        }
        if (recentSubstances.size() > 3) {
            double severity = Math.min(1.0, recentSubstances.size() / 8.0);
            factors.add(new RiskFactor("Multiple Substances", severity,
                    recentSubstances.size() + " different substances used recently"));
            mitigations.put("polydrug", FOCUS_ON_ONE);
            overall += severity * POLYDRUG_WEIGHT;
        }

        // 差评趋势
        int recentNegative = 0;
        for (Experience experience : mostRecent) {
            if (experience.isRated() && experience.overallRating() <= 2) {
                recentNegative++;
            }
        }
        if (recentNegative > 1) {
            double severity = recentNegative / (double) RECENT_EXPERIENCES;
            factors.add(new RiskFactor("Recent Negative Experiences", severity,
                    recentNegative + " negative experiences in the last " + RECENT_EXPERIENCES));
            mitigations.put("negative-trend", REVIEW_SET_AND_SETTING);
            overall += severity * NEGATIVE_TREND_WEIGHT;
        }

        RiskAssessment assessment = new RiskAssessment(overall, factors, new ArrayList<>(mitigations.values()));
        RiskLevel level = assessment.level();
        log.debug("Risk assessment: overall={}, level={}, factors={}", assessment.overallRisk(), level, factors.size());

        Insight insight = new Insight(
                "current-risk-assessment",
                "Current Risk Level: " + level,
                "Based on recent activity patterns and experience history",
                0.8,
                severityOf(level),
                Map.of("overall_risk", assessment.overallRisk(), "reference_time", reference.toString()));

        List<Recommendation> recommendations = new ArrayList<>();
        for (Map.Entry<String, String> mitigation : mitigations.entrySet()) {
            recommendations.add(new Recommendation(
                    "risk-mitigation-" + mitigation.getKey(),
                    "Risk Mitigation",
                    mitigation.getValue(),
                    true,
                    priorityOf(level),
                    RecommendationCategory.SAFETY));
        }

        List<Map<String, Object>> factorData = new ArrayList<>();
        for (RiskFactor factor : factors) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("name", factor.factor());
            point.put("value", factor.severity());
            factorData.add(point);
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("overall_risk", assessment.overallRisk());
        data.put("level", level.name());
        data.put("risk_factors", factorData);
        VisualizationData gauge = new VisualizationData(VisualizationType.GAUGE, data,
                "Risk Assessment Dashboard",
                "Current risk level and contributing factors");

        return new AnalyticsResult(List.of(insight), recommendations, assessment, List.of(gauge));
    }

    static InsightSeverity severityOf(RiskLevel level) {
        switch (level) {
            case HIGH:
                return InsightSeverity.HIGH;
            case MEDIUM:
                return InsightSeverity.MEDIUM;
            default:
                return InsightSeverity.LOW;
        }
    }

    static RecommendationPriority priorityOf(RiskLevel level) {
        switch (level) {
            case HIGH:
                return RecommendationPriority.HIGH;
            case MEDIUM:
                return RecommendationPriority.MEDIUM;
            default:
                return RecommendationPriority.LOW;
        }
    }
}
