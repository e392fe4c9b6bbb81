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
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 使用间隔分析
 * 每种物质至少 3 次有日期的体验时，计算相邻两次的平均间隔 (天) 并与最小安全间隔比较
 */
@Slf4j
public class TimingAnalyzer implements PatternAnalysis {

    static final int MIN_DATED_EXPERIENCES = 3;
    static final int DEFAULT_MIN_INTERVAL_DAYS = 7;
    static final double CONFIDENCE = 0.8;

    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    /**
     * 最小安全间隔 (天)，按顺序做子串匹配 (不区分大小写)
     */
    static final Map<String, Integer> MIN_SAFE_INTERVAL_DAYS;

    static {
        Map<String, Integer> intervals = new LinkedHashMap<>();
        intervals.put("LSD", 14);
        intervals.put("Psilocybin", 14);
        intervals.put("Mescaline", 14);
        intervals.put("MDMA", 90);
        intervals.put("MDA", 90);
        intervals.put("DMT", 1);
        intervals.put("Nitrous", 1);
        MIN_SAFE_INTERVAL_DAYS = Collections.unmodifiableMap(intervals);
    }

    @Override
    public AnalyticsResult analyze(AnalyticsContext context) {
        Map<String, List<Instant>> datesBySubstance = collect(context.experiencesInRange());

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        Map<String, Object> timelines = new LinkedHashMap<>();

        for (Map.Entry<String, List<Instant>> entry : datesBySubstance.entrySet()) {
            if (PatternAnalysis.cancelled()) {
                log.debug("Timing analysis cancelled, returning partial result");
                break;
            }
            String substance = entry.getKey();
            List<Instant> dates = entry.getValue();
            if (dates.size() < MIN_DATED_EXPERIENCES) {
                continue;
            }
            Collections.sort(dates);

            List<Double> intervals = new ArrayList<>(dates.size() - 1);
            for (int i = 1; i < dates.size(); i++) {
                intervals.add(Duration.between(dates.get(i - 1), dates.get(i)).toMillis() / MILLIS_PER_DAY);
            }
            timelines.put(substance, intervals);

            double averageDays = Statistics.mean(intervals);
            int minimumDays = minimumIntervalDays(substance);
            if (averageDays < minimumDays) {
                double ratio = averageDays / minimumDays;
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("substance", substance);
                metadata.put("average_interval_days", averageDays);
                metadata.put("minimum_interval_days", minimumDays);
                insights.add(new Insight(
                        "frequent-use-" + substance,
                        "Frequent Use Pattern Detected",
                        "Your " + substance + " use (avg every " + Statistics.oneDecimal(averageDays)
                                + " days) is below the recommended interval of " + minimumDays + " days",
                        CONFIDENCE,
                        severityOf(ratio),
                        metadata));
                recommendations.add(new Recommendation(
                        "spacing-recommendation-" + substance,
                        "Increase Time Between Uses",
                        "Consider spacing " + substance + " experiences at least " + minimumDays + " days apart",
                        true,
                        RecommendationPriority.HIGH,
                        RecommendationCategory.SAFETY));
            }
        }

        List<VisualizationData> visualizations = new ArrayList<>();
        if (!timelines.isEmpty()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("substance_timelines", timelines);
            data.put("recommended_intervals", MIN_SAFE_INTERVAL_DAYS);
            visualizations.add(new VisualizationData(VisualizationType.TIMELINE, data,
                    "Usage Timing Patterns",
                    "Intervals between uses against recommended minimum intervals"));
        }
        return new AnalyticsResult(insights, recommendations, null, visualizations);
    }

    public static int minimumIntervalDays(String substance) {
        String name = substance.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Integer> entry : MIN_SAFE_INTERVAL_DAYS.entrySet()) {
            if (name.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                return entry.getValue();
            }
        }
        return DEFAULT_MIN_INTERVAL_DAYS;
    }

    static InsightSeverity severityOf(double ratio) {
        if (ratio < 0.5) {
            return InsightSeverity.HIGH;
        }
        if (ratio < 0.7) {
            return InsightSeverity.MEDIUM;
        }
        return InsightSeverity.LOW;
    }

    private Map<String, List<Instant>> collect(List<Experience> experiences) {
        Map<String, List<Instant>> dates = new LinkedHashMap<>();
        for (Experience experience : experiences) {
            Optional<Instant> date = experience.effectiveDate();
            if (date.isEmpty()) {
                continue;
            }
            for (String substance : experience.substanceNames()) {
                dates.computeIfAbsent(substance, k -> new ArrayList<>()).add(date.get());
            }
        }
        return dates;
    }
}
