package com.insightframe.plugin.pattern;

import com.insightframe.api.capability.AnalyticsCapability;
import com.insightframe.api.capability.PluginCapability;
import com.insightframe.api.capability.VisualizationCapability;
import com.insightframe.api.context.PluginContext;
import com.insightframe.api.plugin.InsightPlugin;
import com.insightframe.api.plugin.Permission;
import com.insightframe.api.plugin.PluginManifest;
import com.insightframe.plugin.pattern.render.RiskGaugeRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 模式识别插件
 * <p>
 * 每种分析暴露为一个独立的分析能力，另提供风险仪表盘的文本渲染能力。
 * 插件偏好 {@code enabled-analyses} (逗号分隔的能力ID) 可以缩小暴露的分析范围，
 * 在每次 initialize 时读取。
 */
@Slf4j
public class PatternRecognitionPlugin implements InsightPlugin {

    public static final String ID = "smart-pattern-recognition";

    public static final String ENABLED_ANALYSES_KEY = "enabled-analyses";

    public static final String RISK_GAUGE_ID = "risk-gauge";

    /**
     * 作为内置插件注册时使用的清单，与包内 plugin.yml 保持一致
     */
    public static final PluginManifest MANIFEST = PluginManifest.builder()
            .id(ID)
            .name("Smart Pattern Recognition")
            .version("1.0.0")
            .description("Statistical analysis of substance interactions, tolerance, quality, timing and risk")
            .author("InsightFrame")
            .permissions(EnumSet.of(Permission.READ_EXPERIENCES, Permission.READ_SUBSTANCES, Permission.ANALYTICS_ACCESS))
            .entryPoint(PatternRecognitionPlugin.class.getName())
            .build();

    private final PatternRecognitionAnalyzer analyzer;

    private volatile List<PluginCapability> capabilities = List.of();

    public PatternRecognitionPlugin() {
        this(new PatternRecognitionAnalyzer());
    }

    public PatternRecognitionPlugin(PatternRecognitionAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Override
    public void initialize(PluginContext context) {
        Set<AnalysisType> enabled = AnalysisType.parseList(
                context.preferences().getString(ENABLED_ANALYSES_KEY, ""));

        List<PluginCapability> exposed = new ArrayList<>();
        for (AnalysisType type : enabled) {
            Set<AnalysisType> only = EnumSet.of(type);
            exposed.add(new AnalyticsCapability(type.getCapabilityId(), type.getDisplayName(), type.getDescription(),
                    analyticsContext -> analyzer.analyze(analyticsContext, only)));
        }
        exposed.add(new VisualizationCapability(RISK_GAUGE_ID, "Risk Gauge",
                "Renders risk assessment gauges as plain text", new RiskGaugeRenderer()));

        this.capabilities = List.copyOf(exposed);
        log.info("[{}] Initialized with analyses {}", context.getPluginId(), enabled);
    }

    @Override
    public void shutdown() {
        this.capabilities = List.of();
        log.info("[{}] Shut down", ID);
    }

    @Override
    public List<PluginCapability> getCapabilities() {
        return capabilities;
    }

    public PatternRecognitionAnalyzer getAnalyzer() {
        return analyzer;
    }
}
