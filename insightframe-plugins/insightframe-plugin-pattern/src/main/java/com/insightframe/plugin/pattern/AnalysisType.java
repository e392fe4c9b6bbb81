package com.insightframe.plugin.pattern;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 模式识别支持的分析种类，每种对应一个分析能力
 */
@Slf4j
@Getter
public enum AnalysisType {
    INTERACTION("substance-interaction-detection", "Substance Interaction Detection",
            "Detect potentially dangerous substance combinations"),
    TOLERANCE("tolerance-tracking", "Personal Tolerance Tracking",
            "Track tolerance patterns and dose trends"),
    QUALITY("experience-quality-correlation", "Experience Quality Correlation",
            "Identify factors that lead to positive or negative experiences"),
    TIMING("timing-optimization", "Timing Pattern Analysis",
            "Compare usage intervals against minimum safe intervals"),
    RISK("risk-assessment", "Risk Assessment",
            "Aggregate risk score from recent activity");

    private final String capabilityId;
    private final String displayName;
    private final String description;

    AnalysisType(String capabilityId, String displayName, String description) {
        this.capabilityId = capabilityId;
        this.displayName = displayName;
        this.description = description;
    }

    /**
     * 按能力ID或常量名查找 (不区分大小写)
     */
    public static Optional<AnalysisType> fromId(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (AnalysisType type : values()) {
            if (type.capabilityId.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * 解析逗号分隔的列表；空值表示全部，未知项忽略
     */
    public static Set<AnalysisType> parseList(String value) {
        if (value == null || value.isBlank()) {
            return Collections.unmodifiableSet(EnumSet.allOf(AnalysisType.class));
        }
        Set<AnalysisType> types = EnumSet.noneOf(AnalysisType.class);
        for (String item : value.split(",")) {
            if (item.isBlank()) {
                continue;
            }
            Optional<AnalysisType> type = fromId(item);
            if (type.isPresent()) {
                types.add(type.get());
            } else {
                log.warn("Ignoring unknown analysis type '{}'", item.trim());
            }
        }
        return Collections.unmodifiableSet(types);
    }
}
