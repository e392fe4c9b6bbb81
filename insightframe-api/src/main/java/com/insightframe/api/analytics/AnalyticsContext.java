package com.insightframe.api.analytics;

import com.insightframe.api.journal.Experience;
import com.insightframe.api.journal.Substance;
import com.insightframe.api.journal.TimeRange;
import lombok.Builder;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 一次分析的输入，只读，每次调用独立构造
 *
 * @param experiences 有序的历史体验记录
 * @param substances  已知物质目录，可为空列表
 * @param timeRange   可选的时间范围
 * @param zone        日历分桶使用的时区，默认 UTC
 */
@Builder
public record AnalyticsContext(List<Experience> experiences,
                               List<Substance> substances,
                               TimeRange timeRange,
                               ZoneId zone) {

    public AnalyticsContext {
        experiences = experiences == null ? List.of() : List.copyOf(experiences);
        substances = substances == null ? List.of() : List.copyOf(substances);
        zone = zone == null ? ZoneOffset.UTC : zone;
    }

    public static AnalyticsContext of(List<Experience> experiences) {
        return new AnalyticsContext(experiences, List.of(), null, null);
    }

    public Optional<TimeRange> range() {
        return Optional.ofNullable(timeRange);
    }

    /**
     * 落在时间范围内的体验；未设置范围时返回全部
     * 无日期的体验在设置了范围时被排除
     */
    public List<Experience> experiencesInRange() {
        if (timeRange == null) {
            return experiences;
        }
        return experiences.stream()
                .filter(e -> e.effectiveDate().map(timeRange::contains).orElse(false))
                .collect(Collectors.toList());
    }
}
