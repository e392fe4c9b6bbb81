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

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 体验质量相关性
 * 评分样本不足 5 条时只返回一条 LOW 级别的数据不足提示
 */
@Slf4j
public class QualityCorrelationAnalyzer implements PatternAnalysis {

    static final int MIN_RATED_EXPERIENCES = 5;
    static final double OPTIMAL_AVERAGE = 4.0;
    static final double SUBOPTIMAL_AVERAGE = 2.5;

    @Override
    public AnalyticsResult analyze(AnalyticsContext context) {
        List<Experience> rated = new ArrayList<>();
        for (Experience experience : context.experiencesInRange()) {
            if (experience.isRated()) {
                rated.add(experience);
            }
        }

        if (rated.size() < MIN_RATED_EXPERIENCES) {
            return new AnalyticsResult(List.of(new Insight(
                    "insufficient-data",
                    "Insufficient Data for Quality Analysis",
                    "At least " + MIN_RATED_EXPERIENCES + " rated experiences are needed for quality correlation, found "
                            + rated.size(),
                    1.0,
                    InsightSeverity.LOW)), List.of());
        }

        int positive = 0;
        int negative = 0;
        for (Experience experience : rated) {
            if (experience.overallRating() >= 4) {
                positive++;
            } else if (experience.overallRating() <= 2) {
                negative++;
            }
        }

        Map<String, Double> locationAverages = averageByLocation(rated);
        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();

        // 只有一个地点时无从比较
        if (locationAverages.size() > 1) {
            for (Map.Entry<String, Double> entry : locationAverages.entrySet()) {
                if (PatternAnalysis.cancelled()) {
                    log.debug("Quality analysis cancelled, returning partial result");
                    break;
                }
                String location = entry.getKey();
                double average = entry.getValue();
                if (average >= OPTIMAL_AVERAGE) {
                    recommendations.add(new Recommendation(
                            "optimal-location-" + location,
                            "Optimal Location Identified",
                            location + " appears to be a good setting for your experiences (avg rating: "
                                    + Statistics.oneDecimal(average) + ")",
                            true,
                            RecommendationPriority.MEDIUM,
                            RecommendationCategory.OPTIMIZATION));
                } else if (average <= SUBOPTIMAL_AVERAGE) {
                    insights.add(new Insight(
                            "suboptimal-location-" + location,
                            "Suboptimal Setting Detected",
                            location + " may not be ideal for your experiences (avg rating: "
                                    + Statistics.oneDecimal(average) + ")",
                            0.7,
                            InsightSeverity.MEDIUM,
                            Map.of("location", location, "average_rating", average)));
                }
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("location_ratings", locationAverages);
        data.put("positive_factors", positive);
        data.put("negative_factors", negative);
        data.put("day_of_week_ratings", averageByDayOfWeek(rated, context.zone()));
        VisualizationData chart = new VisualizationData(VisualizationType.BAR_CHART, data,
                "Experience Quality Factors",
                "Settings and weekdays that correlate with positive and negative experiences");

        return new AnalyticsResult(insights, recommendations, null, List.of(chart));
    }

    private Map<String, Double> averageByLocation(List<Experience> rated) {
        Map<String, List<Integer>> ratings = new LinkedHashMap<>();
        for (Experience experience : rated) {
            String location = experience.location();
            if (location == null || location.isBlank()) {
                continue;
            }
            ratings.computeIfAbsent(location.trim(), k -> new ArrayList<>()).add(experience.overallRating());
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        ratings.forEach((location, values) -> averages.put(location, Statistics.mean(values)));
        return averages;
    }

    /**
     * 按上下文时区计算星期几，键为 MONDAY..SUNDAY
     */
    private Map<String, Double> averageByDayOfWeek(List<Experience> rated, ZoneId zone) {
        Map<DayOfWeek, List<Integer>> ratings = new EnumMap<>(DayOfWeek.class);
        for (Experience experience : rated) {
            Optional<Instant> date = experience.effectiveDate();
            if (date.isEmpty()) {
                continue;
            }
            DayOfWeek day = date.get().atZone(zone).getDayOfWeek();
            ratings.computeIfAbsent(day, k -> new ArrayList<>()).add(experience.overallRating());
        }
        Map<String, Double> averages = new LinkedHashMap<>();
        ratings.forEach((day, values) -> averages.put(day.name(), Statistics.mean(values)));
        return averages;
    }
}
