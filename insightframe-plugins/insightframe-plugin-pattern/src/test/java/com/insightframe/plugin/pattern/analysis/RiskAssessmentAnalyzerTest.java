package com.insightframe.plugin.pattern.analysis;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.analytics.RiskAssessment;
import com.insightframe.api.analytics.RiskLevel;
import com.insightframe.api.analytics.VisualizationType;
import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.TimeRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static com.insightframe.plugin.pattern.Journal.T0;
import static com.insightframe.plugin.pattern.Journal.experience;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RiskAssessmentAnalyzer 单元测试")
class RiskAssessmentAnalyzerTest {

    private static final Instant NOW = T0.plus(Duration.ofDays(5));

    private final RiskAssessmentAnalyzer analyzer = new RiskAssessmentAnalyzer(Clock.fixed(NOW, ZoneOffset.UTC));

    /**
     * 五天内 50 次体验，每次两种物质，共 10 种，全部评分 1
     */
    private static List<Experience> heavyUse() {
        List<Experience> experiences = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            Instant date = NOW.minus(Duration.ofHours(2L * i));
            experiences.add(experience(date, 1, "S" + (2 * i % 10), "S" + ((2 * i + 1) % 10)));
        }
        return experiences;
    }

    @Nested
    @DisplayName("风险因子")
    class FactorTests {

        @Test
        @DisplayName("三个因子全满时总风险截断为 1.0，HIGH")
        void allFactorsSaturated() {
            AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(heavyUse()));

            RiskAssessment assessment = result.riskAssessment();
            assertNotNull(assessment);
            assertEquals(1.0, assessment.overallRisk(), 1e-9);
            assertEquals(RiskLevel.HIGH, assessment.level());
            assertEquals(3, assessment.riskFactors().size());
            assertEquals(List.of(
                    RiskAssessmentAnalyzer.TAKE_A_BREAK,
                    RiskAssessmentAnalyzer.FOCUS_ON_ONE,
                    RiskAssessmentAnalyzer.REVIEW_SET_AND_SETTING), assessment.mitigationStrategies());
            assertEquals(List.of("risk-mitigation-frequency", "risk-mitigation-polydrug", "risk-mitigation-negative-trend"),
                    result.recommendations().stream().map(r -> r.id()).toList());
            assertEquals("Current Risk Level: HIGH", result.insights().get(0).title());
        }

        @Test
        @DisplayName("没有风险因子时为 LOW 且没有缓解建议")
        void lowRisk() {
            AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(List.of(
                    experience(NOW.minus(Duration.ofDays(2)), 5, "Cannabis"),
                    experience(NOW.minus(Duration.ofDays(40)), 4, "LSD"))));

            assertEquals(0.0, result.riskAssessment().overallRisk());
            assertEquals(RiskLevel.LOW, result.riskAssessment().level());
            assertTrue(result.recommendations().isEmpty());
            assertEquals("current-risk-assessment", result.insights().get(0).id());
        }

        @Test
        @DisplayName("仅频率因子：7 次体验得 0.21")
        void frequencyOnly() {
            List<Experience> experiences = new ArrayList<>();
            for (int i = 0; i < 7; i++) {
                experiences.add(experience(NOW.minus(Duration.ofDays(i)), 4, "Cannabis"));
            }

            RiskAssessment assessment = analyzer.analyze(AnalyticsContext.of(experiences)).riskAssessment();

            assertEquals(0.21, assessment.overallRisk(), 1e-9);
            assertEquals("High Recent Activity", assessment.riskFactors().get(0).factor());
        }
    }

    @Test
    @DisplayName("设置时间范围时以范围终点为参考时间")
    void referenceTimeFromRange() {
        Instant end = T0.minus(Duration.ofDays(100));
        List<Experience> experiences = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            experiences.add(experience(end.minus(Duration.ofDays(i)), 4, "Cannabis"));
        }
        AnalyticsContext context = AnalyticsContext.builder()
                .experiences(experiences)
                .timeRange(new TimeRange(end.minus(Duration.ofDays(60)), end))
                .build();

        RiskAssessment assessment = analyzer.analyze(context).riskAssessment();

        // 以时钟为参考时这些体验都在 30 天窗口之外
        assertEquals(0.15, assessment.overallRisk(), 1e-9);
    }

    @Test
    @DisplayName("输出仪表盘载荷")
    void gaugePayload() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(heavyUse()));

        assertEquals(VisualizationType.GAUGE, result.visualizations().get(0).type());
        assertEquals("HIGH", result.visualizations().get(0).data().get("level"));
    }
}
