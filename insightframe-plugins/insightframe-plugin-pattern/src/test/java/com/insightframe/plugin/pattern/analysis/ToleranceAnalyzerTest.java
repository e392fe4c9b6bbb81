package com.insightframe.plugin.pattern.analysis;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.analytics.Insight;
import com.insightframe.api.analytics.InsightSeverity;
import com.insightframe.api.analytics.VisualizationType;
import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Ingestion;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.insightframe.plugin.pattern.Journal.daysAfter;
import static com.insightframe.plugin.pattern.Journal.dosed;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ToleranceAnalyzer 单元测试")
class ToleranceAnalyzerTest {

    private final ToleranceAnalyzer analyzer = new ToleranceAnalyzer();

    private static List<Experience> series(double[] doses, int[] ratings) {
        List<Experience> experiences = new ArrayList<>();
        for (int i = 0; i < doses.length; i++) {
            experiences.add(dosed(daysAfter(i * 7), doses[i], ratings == null ? null : ratings[i], "LSD"));
        }
        return experiences;
    }

    @Test
    @DisplayName("四次间隔中三次增长超过 20%：MEDIUM 耐受警告")
    void toleranceBuildup() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(
                series(new double[]{10, 12, 15, 20, 26}, new int[]{4, 4, 4, 4, 4})));

        Insight insight = result.insights().stream()
                .filter(i -> i.id().equals("tolerance-buildup-LSD"))
                .findFirst()
                .orElseThrow();
        assertEquals(0.75, insight.confidence(), 1e-9);
        assertEquals(InsightSeverity.MEDIUM, insight.severity());
        assertTrue(result.recommendations().stream().anyMatch(r -> r.id().equals("tolerance-break-LSD")));
        // 评分恒定，方差为 0，不应给出剂量相关结论
        assertTrue(result.insights().stream().noneMatch(i -> i.id().startsWith("dosage-quality-inverse")));
    }

    @Test
    @DisplayName("剂量越高评分越低时给出相关性结论")
    void inverseDoseQuality() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(
                series(new double[]{100, 100, 150, 150, 200}, new int[]{5, 5, 3, 3, 1})));

        assertTrue(result.insights().stream().anyMatch(i -> i.id().equals("dosage-quality-inverse-LSD")));
        assertTrue(result.recommendations().stream().anyMatch(r -> r.id().equals("reduce-dosage-LSD")));
    }

    @Test
    @DisplayName("五次剂量恒为 10 时没有耐受警告")
    void constantDosesRaiseNothing() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(
                series(new double[]{10, 10, 10, 10, 10}, new int[]{4, 4, 4, 4, 4})));

        assertTrue(result.insights().isEmpty());
        assertTrue(result.recommendations().isEmpty());
        assertEquals(VisualizationType.LINE_CHART, result.visualizations().get(0).type());
    }

    @Test
    @DisplayName("摄入没有时间时仍计算剂量与评分的相关性")
    void undatedIngestionsStillCorrelate() {
        List<Experience> experiences = new ArrayList<>();
        double[] doses = {10, 20, 30};
        int[] ratings = {5, 3, 1};
        for (int i = 0; i < doses.length; i++) {
            experiences.add(Experience.builder()
                    .id(100 + i)
                    .overallRating(ratings[i])
                    .ingestions(List.of(Ingestion.builder()
                            .substanceName("X")
                            .dose(doses[i])
                            .units("mg")
                            .build()))
                    .build());
        }

        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(experiences));

        Insight insight = result.insights().stream()
                .filter(i -> i.id().equals("dosage-quality-inverse-X"))
                .findFirst()
                .orElseThrow();
        assertEquals(1.0, insight.confidence(), 1e-9);
        assertTrue(result.insights().stream().noneMatch(i -> i.id().startsWith("tolerance-buildup")));
        // 没有带时间的记录，不输出趋势图
        assertTrue(result.visualizations().isEmpty());
    }

    @Test
    @DisplayName("少于三次有剂量的记录时只输出趋势图")
    void tooFewObservations() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(
                series(new double[]{10, 30}, null)));

        assertTrue(result.insights().isEmpty());
        assertEquals(VisualizationType.LINE_CHART, result.visualizations().get(0).type());
    }

    @Test
    @DisplayName("严重度阈值")
    void severityThresholds() {
        assertEquals(InsightSeverity.HIGH, ToleranceAnalyzer.severityOf(0.9));
        assertEquals(InsightSeverity.MEDIUM, ToleranceAnalyzer.severityOf(0.7));
        assertEquals(InsightSeverity.LOW, ToleranceAnalyzer.severityOf(0.55));
    }
}
