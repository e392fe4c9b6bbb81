package com.insightframe.api.capability;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;

/**
 * 分析能力
 */
public record AnalyticsCapability(String id, String name, String description, Analyzer analyzer)
        implements PluginCapability {

    @Override
    public CapabilityKind kind() {
        return CapabilityKind.ANALYTICS;
    }

    public AnalyticsResult analyze(AnalyticsContext context) throws Exception {
        return analyzer.analyze(context);
    }

    /**
     * 分析函数
     * 长时间运行的实现应检查线程中断标志并尽早返回
     */
    @FunctionalInterface
    public interface Analyzer {
        AnalyticsResult analyze(AnalyticsContext context) throws Exception;
    }
}
