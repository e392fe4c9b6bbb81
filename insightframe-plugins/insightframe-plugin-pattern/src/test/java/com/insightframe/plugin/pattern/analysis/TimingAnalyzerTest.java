package com.insightframe.plugin.pattern.analysis;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.analytics.Insight;
import com.insightframe.api.analytics.InsightSeverity;
import com.insightframe.api.analytics.RecommendationPriority;
import com.insightframe.api.analytics.VisualizationType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.insightframe.plugin.pattern.Journal.daysAfter;
import static com.insightframe.plugin.pattern.Journal.experience;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TimingAnalyzer 单元测试")
class TimingAnalyzerTest {

    private final TimingAnalyzer analyzer = new TimingAnalyzer();

    @Test
    @DisplayName("LSD 每五天一次：低于 14 天间隔，HIGH")
    void frequentLsd() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(List.of(
                experience(daysAfter(0), 4, "LSD"),
                experience(daysAfter(5), 4, "LSD"),
                experience(daysAfter(10), 4, "LSD"),
                experience(daysAfter(15), 4, "LSD"))));

        Insight insight = result.insights().get(0);
        assertEquals("frequent-use-LSD", insight.id());
        assertEquals(InsightSeverity.HIGH, insight.severity());
        assertEquals(0.8, insight.confidence(), 1e-9);
        assertEquals(5.0, (Double) insight.metadata().get("average_interval_days"), 1e-9);
        assertEquals("spacing-recommendation-LSD", result.recommendations().get(0).id());
        assertEquals(RecommendationPriority.HIGH, result.recommendations().get(0).priority());
        assertEquals(VisualizationType.TIMELINE, result.visualizations().get(0).type());
    }

    @Test
    @DisplayName("间隔足够或有日期的记录少于三条时不报警")
    void noWarning() {
        AnalyticsResult spaced = analyzer.analyze(AnalyticsContext.of(List.of(
                experience(daysAfter(0), 4, "Cannabis"),
                experience(daysAfter(8), 4, "Cannabis"),
                experience(daysAfter(16), 4, "Cannabis"))));
        AnalyticsResult sparse = analyzer.analyze(AnalyticsContext.of(List.of(
                experience(daysAfter(0), 4, "MDMA"),
                experience(daysAfter(1), 4, "MDMA"))));

        assertTrue(spaced.insights().isEmpty());
        assertTrue(sparse.isEmpty());
    }

    @Test
    @DisplayName("最小间隔按子串匹配，未知物质为 7 天")
    void minimumIntervals() {
        assertEquals(14, TimingAnalyzer.minimumIntervalDays("1P-LSD"));
        assertEquals(90, TimingAnalyzer.minimumIntervalDays("mdma"));
        assertEquals(1, TimingAnalyzer.minimumIntervalDays("Nitrous Oxide"));
        assertEquals(7, TimingAnalyzer.minimumIntervalDays("Caffeine"));
    }

    @Test
    @DisplayName("严重度按平均间隔与最小间隔之比")
    void severityByRatio() {
        assertEquals(InsightSeverity.HIGH, TimingAnalyzer.severityOf(0.3));
        assertEquals(InsightSeverity.MEDIUM, TimingAnalyzer.severityOf(0.6));
        assertEquals(InsightSeverity.LOW, TimingAnalyzer.severityOf(0.9));
    }
}
