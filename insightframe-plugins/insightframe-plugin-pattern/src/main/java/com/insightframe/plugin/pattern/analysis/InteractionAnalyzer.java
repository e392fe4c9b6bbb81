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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 物质组合相互作用检测
 * <p>
 * 按单次体验中出现的物质集合分组 (至少两种物质)：
 * <ul>
 *     <li>同一组合出现至少 2 次且差评 (评分 ≤ 2) 占比超过 0.6 时给出警告和回避建议</li>
 *     <li>组合中任一物质属于已知危险组合时给出 CRITICAL 警告</li>
 * </ul>
 */
@Slf4j
public class InteractionAnalyzer implements PatternAnalysis {

    static final double NEGATIVE_FRACTION_THRESHOLD = 0.6;
    static final double CRITICAL_FRACTION_THRESHOLD = 0.8;
    static final double KNOWN_DANGER_CONFIDENCE = 0.95;

    /**
     * 已知危险组合，成员按名称子串匹配 (不区分大小写)
     */
    static final List<List<String>> KNOWN_DANGEROUS_PAIRS = List.of(
            List.of("MDMA", "MAOI"),
            List.of("Cocaine", "Alcohol"),
            List.of("Tramadol", "MDMA"),
            List.of("Lithium", "LSD"),
            List.of("Lithium", "Psilocybin")
    );

    @Override
    public AnalyticsResult analyze(AnalyticsContext context) {
        Map<SortedSet<String>, List<Experience>> combinations = groupByCombination(context.experiencesInRange());

        List<Insight> insights = new ArrayList<>();
        List<Recommendation> recommendations = new ArrayList<>();
        List<Map<String, Object>> safetyScores = new ArrayList<>();

        for (Map.Entry<SortedSet<String>, List<Experience>> entry : combinations.entrySet()) {
            if (PatternAnalysis.cancelled()) {
                log.debug("Interaction analysis cancelled, returning partial result");
                break;
            }
            SortedSet<String> substances = entry.getKey();
            List<Experience> experiences = entry.getValue();
            String key = String.join("-", substances);
            String label = String.join(" + ", substances);

            int total = experiences.size();
            int negative = 0;
            int rated = 0;
            double ratingSum = 0.0;
            for (Experience experience : experiences) {
                if (experience.isRated()) {
                    rated++;
                    ratingSum += experience.overallRating();
                    if (experience.overallRating() <= 2) {
                        negative++;
                    }
                }
            }

            if (total >= 2) {
                double fraction = (double) negative / total;
                if (fraction > NEGATIVE_FRACTION_THRESHOLD) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("substances", List.copyOf(substances));
                    metadata.put("negative_experiences", negative);
                    metadata.put("total_experiences", total);
                    insights.add(new Insight(
                            "dangerous-combination-" + key,
                            "Potentially Dangerous Combination Detected",
                            "The combination of " + label + " has resulted in negative experiences "
                                    + negative + "/" + total + " times",
                            Math.min(0.9, fraction),
                            fraction > CRITICAL_FRACTION_THRESHOLD ? InsightSeverity.CRITICAL : InsightSeverity.HIGH,
                            metadata));
                    recommendations.add(new Recommendation(
                            "avoid-combination-" + key,
                            "Avoid This Combination",
                            "Consider avoiding the combination of " + label + " based on your experience history",
                            true,
                            RecommendationPriority.HIGH,
                            RecommendationCategory.SAFETY));
                }
            }

            List<String> knownPair = matchKnownDangerousPair(substances);
            if (knownPair != null) {
                insights.add(new Insight(
                        "known-dangerous-" + key,
                        "Known Dangerous Interaction",
                        "This combination contains substances known to interact dangerously (see "
                                + String.join(" + ", knownPair) + ")",
                        KNOWN_DANGER_CONFIDENCE,
                        InsightSeverity.CRITICAL,
                        Map.of("pair", knownPair)));
            }

            Map<String, Object> score = new LinkedHashMap<>();
            score.put("substances", List.copyOf(substances));
            score.put("experiences", total);
            score.put("average_rating", rated == 0 ? null : ratingSum / rated);
            safetyScores.add(score);
        }

        List<VisualizationData> visualizations = new ArrayList<>();
        if (!safetyScores.isEmpty()) {
            Map<String, Object> data = new LinkedHashMap<>();
            List<List<String>> nodes = new ArrayList<>();
            for (SortedSet<String> substances : combinations.keySet()) {
                nodes.add(List.copyOf(substances));
            }
            data.put("combinations", nodes);
            data.put("safety_scores", safetyScores);
            visualizations.add(new VisualizationData(VisualizationType.NETWORK_GRAPH, data,
                    "Substance Interaction Network",
                    "Substance combinations and their average ratings"));
        }
        return new AnalyticsResult(insights, recommendations, null, visualizations);
    }

    /**
     * 物质集合排序后作为键，保证同一组合的ID稳定
     */
    private Map<SortedSet<String>, List<Experience>> groupByCombination(List<Experience> experiences) {
        Map<SortedSet<String>, List<Experience>> combinations = new LinkedHashMap<>();
        for (Experience experience : experiences) {
            Set<String> names = experience.substanceNames();
            if (names.size() < 2) {
                continue;
            }
            combinations.computeIfAbsent(new TreeSet<>(names), k -> new ArrayList<>()).add(experience);
        }
        return combinations;
    }

    /**
     * 组合中任一物质命中某个已知危险组合的成员即视为命中，返回第一个命中的组合
     * 每个物质组合最多给出一条警告
     */
    static List<String> matchKnownDangerousPair(Set<String> substances) {
        for (List<String> pair : KNOWN_DANGEROUS_PAIRS) {
            for (String member : pair) {
                if (containsMatch(substances, member)) {
                    return pair;
                }
            }
        }
        return null;
    }

    private static boolean containsMatch(Set<String> substances, String member) {
        String needle = member.toLowerCase(Locale.ROOT);
        for (String substance : substances) {
            if (substance.toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
