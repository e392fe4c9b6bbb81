package com.insightframe.plugin.pattern.render;

import com.insightframe.api.analytics.RiskLevel;
import com.insightframe.api.analytics.VisualizationData;
import com.insightframe.api.analytics.VisualizationType;
import com.insightframe.api.capability.VisualizationCapability;
import com.insightframe.api.visualization.RenderedVisualization;
import com.insightframe.api.visualization.VisualizationContext;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 将 GAUGE 载荷渲染为纯文本仪表盘
 * <pre>
 * Risk Assessment Dashboard
 * [#########-----------] 0.45 MEDIUM
 *   - High Recent Activity: 0.60
 * </pre>
 */
public class RiskGaugeRenderer implements VisualizationCapability.Renderer {

    static final int WIDTH = 20;

    @Override
    public RenderedVisualization render(VisualizationContext context) {
        VisualizationData data = context == null ? null : context.data();
        if (data == null || data.type() != VisualizationType.GAUGE) {
            throw new IllegalArgumentException("risk-gauge renders GAUGE data only, got "
                    + (data == null ? "nothing" : data.type()));
        }

        double risk = number(data.data().get("overall_risk"));
        risk = Math.max(0.0, Math.min(1.0, risk));
        int filled = (int) Math.round(risk * WIDTH);

        StringBuilder body = new StringBuilder();
        if (data.title() != null) {
            body.append(data.title()).append('\n');
        }
        body.append('[')
                .append("#".repeat(filled))
                .append("-".repeat(WIDTH - filled))
                .append("] ")
                .append(String.format(Locale.ROOT, "%.2f", risk))
                .append(' ')
                .append(RiskLevel.of(risk));

        Object factors = data.data().get("risk_factors");
        if (factors instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> factor) {
                    body.append('\n')
                            .append("  - ")
                            .append(factor.get("name"))
                            .append(": ")
                            .append(String.format(Locale.ROOT, "%.2f", number(factor.get("value"))));
                }
            }
        }
        return new RenderedVisualization(RenderedVisualization.TEXT_PLAIN, body.toString());
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
