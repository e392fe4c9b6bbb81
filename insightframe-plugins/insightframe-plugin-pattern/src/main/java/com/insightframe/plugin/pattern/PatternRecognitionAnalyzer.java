package com.insightframe.plugin.pattern;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;
import com.insightframe.plugin.pattern.analysis.InteractionAnalyzer;
import com.insightframe.plugin.pattern.analysis.PatternAnalysis;
import com.insightframe.plugin.pattern.analysis.QualityCorrelationAnalyzer;
import com.insightframe.plugin.pattern.analysis.RiskAssessmentAnalyzer;
import com.insightframe.plugin.pattern.analysis.TimingAnalyzer;
import com.insightframe.plugin.pattern.analysis.ToleranceAnalyzer;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 模式识别分析入口
 * 按请求的种类依次执行各项分析并合并结果，顺序固定为 {@link AnalysisType} 的声明顺序
 */
@Slf4j
public class PatternRecognitionAnalyzer {

    private final Map<AnalysisType, PatternAnalysis> analyses = new EnumMap<>(AnalysisType.class);

    public PatternRecognitionAnalyzer() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock 风险评估在没有时间范围时使用的时钟
     */
    public PatternRecognitionAnalyzer(Clock clock) {
        analyses.put(AnalysisType.INTERACTION, new InteractionAnalyzer());
        analyses.put(AnalysisType.TOLERANCE, new ToleranceAnalyzer());
        analyses.put(AnalysisType.QUALITY, new QualityCorrelationAnalyzer());
        analyses.put(AnalysisType.TIMING, new TimingAnalyzer());
        analyses.put(AnalysisType.RISK, new RiskAssessmentAnalyzer(clock));
    }

    public AnalyticsResult analyze(AnalyticsContext context) {
        return analyze(context, EnumSet.allOf(AnalysisType.class));
    }

    public AnalyticsResult analyze(AnalyticsContext context, Set<AnalysisType> types) {
        List<AnalyticsResult> results = new ArrayList<>();
        for (AnalysisType type : AnalysisType.values()) {
            if (!types.contains(type)) {
                continue;
            }
            if (PatternAnalysis.cancelled()) {
                log.debug("Pattern analysis cancelled before {}", type);
                break;
            }
            results.add(analyses.get(type).analyze(context));
        }
        return AnalyticsResult.merge(results);
    }
}
