package com.insightframe.plugin.pattern;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.api.analytics.Insight;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static com.insightframe.plugin.pattern.Journal.daysAfter;
import static com.insightframe.plugin.pattern.Journal.experience;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PatternRecognitionAnalyzer 单元测试")
class PatternRecognitionAnalyzerTest {

    private final PatternRecognitionAnalyzer analyzer =
            new PatternRecognitionAnalyzer(Clock.fixed(daysAfter(10), ZoneOffset.UTC));

    private static AnalyticsContext sample() {
        return AnalyticsContext.of(List.of(
                experience(daysAfter(0), 1, "Ketamine", "Cannabis"),
                experience(daysAfter(2), 2, "Ketamine", "Cannabis"),
                experience(daysAfter(4), 1, "Ketamine", "Cannabis")));
    }

    @Test
    @DisplayName("全部分析按固定顺序合并，风险评估总是存在")
    void allAnalysesMerged() {
        AnalyticsResult result = analyzer.analyze(sample());

        List<String> ids = result.insights().stream().map(Insight::id).toList();
        assertEquals("dangerous-combination-Cannabis-Ketamine", ids.get(0));
        assertTrue(ids.contains("insufficient-data"));
        assertTrue(ids.contains("frequent-use-Ketamine"));
        assertEquals("current-risk-assessment", ids.get(ids.size() - 1));
        assertNotNull(result.riskAssessment());
    }

    @Test
    @DisplayName("只执行请求的分析")
    void subsetOnly() {
        AnalyticsResult result = analyzer.analyze(sample(), EnumSet.of(AnalysisType.QUALITY));

        assertEquals(List.of("insufficient-data"), result.insights().stream().map(Insight::id).toList());
        assertNull(result.riskAssessment());
    }

    @Test
    @DisplayName("空记录不会出错")
    void emptyInput() {
        AnalyticsResult result = analyzer.analyze(AnalyticsContext.of(List.of()));

        assertNotNull(result.riskAssessment());
        assertEquals(0.0, result.riskAssessment().overallRisk());
    }

    @Test
    @DisplayName("线程被中断时提前返回部分结果")
    void interruptedReturnsEarly() throws Exception {
        AtomicReference<AnalyticsResult> result = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            Thread.currentThread().interrupt();
            result.set(analyzer.analyze(sample()));
        });
        worker.start();
        worker.join(5000);

        assertNotNull(result.get());
        assertTrue(result.get().isEmpty());
    }
}
