package com.insightframe.plugin.pattern.analysis;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.analytics.Insight;
import com.insightframe.api.analytics.InsightSeverity;
import com.insightframe.api.analytics.Recommendation;
import com.insightframe.api.analytics.RecommendationCategory;
import com.insightframe.api.analytics.RecommendationPriority;
import com.insightframe.api.analytics.VisualizationData;
import com.insightframe.api.analytics.VisualizationType;
import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Ingestion;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 耐受性追踪
 * <p>
 * 按物质收集有剂量且有时间的摄入记录，按时间排序后统计相邻两次剂量增长超过 20% 的比例，判断耐受性累积。
 * 另外按体验收集 (剂量, 评分)，不要求摄入时间，计算相关系数判断剂量越高体验越差的趋势。
 */
@Slf4j
public class ToleranceAnalyzer implements PatternAnalysis {

    static final int MIN_OBSERVATIONS = 3;
    static final double INCREASE_FACTOR = 1.2;
    static final double INCREASE_RATIO_THRESHOLD = 0.5;
    static final double NEGATIVE_CORRELATION_THRESHOLD = -0.3;

    @Override
    public AnalyticsResult analyze(AnalyticsContext context) {
        List<Experience> experiences = context.experiencesInRange();
        Map<String, List<DoseObservation>> series = collectSeries(experiences);
        Map<String, List<double[]>> doseRatings = collectDoseRatings(experiences);

        Set<String> substances = new LinkedHashSet<>(series.keySet());
        substances.addAll(doseRatings.keySet());

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        Map<String, Object> trends = new LinkedHashMap<>();

        for (String substance : substances) {
            if (PatternAnalysis.cancelled()) {
                log.debug("Tolerance analysis cancelled, returning partial result");
                break;
            }
            List<DoseObservation> observations = series.getOrDefault(substance, List.of());
            if (!observations.isEmpty()) {
                observations.sort(Comparator.comparing(DoseObservation::time));
                trends.put(substance, toTrendPoints(observations));
            }

            if (observations.size() >= MIN_OBSERVATIONS) {
                double ratio = increaseRatio(observations);
                if (ratio > INCREASE_RATIO_THRESHOLD) {
                    insights.add(new Insight(
                            "tolerance-buildup-" + substance,
                            "Tolerance Buildup Detected",
                            "Your doses of " + substance + " have been increasing over time, indicating tolerance buildup",
                            ratio,
                            severityOf(ratio),
                            Map.of("substance", substance, "increase_ratio", ratio)));
                    recommendations.add(new Recommendation(
                            "tolerance-break-" + substance,
                            "Consider a Tolerance Break",
                            "A tolerance break for " + substance + " could reset your sensitivity and reduce the dose you need",
                            true,
                            RecommendationPriority.MEDIUM,
                            RecommendationCategory.OPTIMIZATION));
                }
            }

            // 剂量与评分的相关性不依赖摄入时间，单独设门槛
            List<double[]> pairs = doseRatings.getOrDefault(substance, List.of());
            if (pairs.size() >= MIN_OBSERVATIONS) {
                List<Double> doses = new ArrayList<>(pairs.size());
                List<Double> ratings = new ArrayList<>(pairs.size());
                for (double[] pair : pairs) {
                    doses.add(pair[0]);
                    ratings.add(pair[1]);
                }
                double correlation = Statistics.pearson(doses, ratings);
                if (correlation < NEGATIVE_CORRELATION_THRESHOLD) {
                    insights.add(new Insight(
                            "dosage-quality-inverse-" + substance,
                            "Higher Doses Linked to Worse Experiences",
                            "Your experience quality with " + substance + " tends to decrease at higher doses",
                            Math.abs(correlation),
                            InsightSeverity.MEDIUM,
                            Map.of("substance", substance, "correlation", correlation)));
                    recommendations.add(new Recommendation(
                            "reduce-dosage-" + substance,
                            "Consider Lower Doses",
                            "Your data suggests better experiences with lower " + substance + " doses",
                            true,
                            RecommendationPriority.MEDIUM,
                            RecommendationCategory.OPTIMIZATION));
                }
            }
        }

        List<VisualizationData> visualizations = new ArrayList<>();
        if (!trends.isEmpty()) {
            visualizations.add(new VisualizationData(VisualizationType.LINE_CHART,
                    Map.of("substance_trends", trends),
                    "Tolerance Patterns Over Time",
                    "Dose and experience rating trends per substance"));
        }
        return new AnalyticsResult(insights, recommendations, null, visualizations);
    }

    /**
     * 相邻剂量增长超过 20% 的次数占间隔数的比例
     */
    static double increaseRatio(List<DoseObservation> observations) {
        int increases = 0;
        for (int i = 1; i < observations.size(); i++) {
            if (observations.get(i).dose() > observations.get(i - 1).dose() * INCREASE_FACTOR) {
                increases++;
            }
        }
        return (double) increases / (observations.size() - 1);
    }

    static InsightSeverity severityOf(double ratio) {
        if (ratio > 0.8) {
            return InsightSeverity.HIGH;
        }
        if (ratio > 0.6) {
            return InsightSeverity.MEDIUM;
        }
        return InsightSeverity.LOW;
    }

    private Map<String, List<DoseObservation>> collectSeries(List<Experience> experiences) {
        Map<String, List<DoseObservation>> bySubstance = new LinkedHashMap<>();
        for (Experience experience : experiences) {
            for (Ingestion ingestion : experience.ingestions()) {
                if (!ingestion.hasDose() || ingestion.time() == null) {
                    continue;
                }
                bySubstance.computeIfAbsent(ingestion.substanceName(), k -> new ArrayList<>())
                        .add(new DoseObservation(ingestion.time(), ingestion.dose(), experience.overallRating()));
            }
        }
        return bySubstance;
    }

    /**
     * 每次体验取该物质的第一条摄入记录，与体验评分组成 (剂量, 评分)
     */
    private Map<String, List<double[]>> collectDoseRatings(List<Experience> experiences) {
        Map<String, List<double[]>> bySubstance = new LinkedHashMap<>();
        for (Experience experience : experiences) {
            if (experience.overallRating() == null) {
                continue;
            }
            Set<String> seen = new HashSet<>();
            for (Ingestion ingestion : experience.ingestions()) {
                if (!seen.add(ingestion.substanceName()) || !ingestion.hasDose()) {
                    continue;
                }
                bySubstance.computeIfAbsent(ingestion.substanceName(), k -> new ArrayList<>())
                        .add(new double[]{ingestion.dose(), experience.overallRating()});
            }
        }
        return bySubstance;
    }

    private List<Map<String, Object>> toTrendPoints(List<DoseObservation> observations) {
        List<Map<String, Object>> points = new ArrayList<>(observations.size());
        for (DoseObservation observation : observations) {
            Map<String, Object> point = new LinkedHashMap<>();
            point.put("time", observation.time().toString());
            point.put("dose", observation.dose());
            point.put("rating", observation.rating());
            points.add(point);
        }
        return points;
    }

    record DoseObservation(Instant time, double dose, Integer rating) {
    }
}
