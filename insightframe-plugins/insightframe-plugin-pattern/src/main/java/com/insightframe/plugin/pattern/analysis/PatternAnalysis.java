package com.insightframe.plugin.pattern.analysis;

import com.insightframe.api.analytics.AnalyticsContext;
import com.insightframe.api.analytics.AnalyticsResult;

/**
 * 单项模式分析
 * 实现为纯函数：只读取上下文，不持有跨调用的状态
 */
@FunctionalInterface
public interface PatternAnalysis {

    AnalyticsResult analyze(AnalyticsContext context);

    /**
     * 分发超时会中断工作线程，循环内用它检查后返回部分结果
     */
    static boolean cancelled() {
        return Thread.currentThread().isInterrupted();
    }
}
