package com.insightframe.api.journal;

import com.insightframe.api.analytics.AnalyticsContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("体验记录模型单元测试")
class ExperienceTest {

    private static final Instant T0 = Instant.parse("2024-03-01T20:00:00Z");

    private static Ingestion ingestion(String substance, Instant time) {
        return Ingestion.builder().substanceName(substance).time(time).dose(100.0).units("mg").build();
    }

    @Test
    @DisplayName("没有日期时回退到最早的摄入时间")
    void effectiveDateFallsBackToIngestions() {
        Experience experience = Experience.builder()
                .id(1)
                .ingestions(List.of(ingestion("LSD", T0.plusSeconds(3600)), ingestion("MDMA", T0)))
                .build();

        assertEquals(Optional.of(T0), experience.effectiveDate());
        assertEquals(Optional.empty(), Experience.builder().id(2).build().effectiveDate());
    }

    @Test
    @DisplayName("物质名称去重并保持顺序")
    void substanceNamesDistinct() {
        Experience experience = Experience.builder()
                .id(1)
                .ingestions(List.of(ingestion("MDMA", T0), ingestion("LSD", T0), ingestion("MDMA", T0)))
                .build();

        assertEquals(List.of("MDMA", "LSD"), List.copyOf(experience.substanceNames()));
        assertEquals(Set.of("MDMA", "LSD"), experience.substanceNames());
    }

    @Test
    @DisplayName("评分必须在 1..5 之间")
    void ratingRange() {
        assertThrows(IllegalArgumentException.class, () -> Experience.builder().id(1).overallRating(6).build());
        assertThrows(IllegalArgumentException.class, () -> Experience.builder().id(1).overallRating(0).build());
        assertTrue(Experience.builder().id(1).overallRating(5).build().isRated());
        assertFalse(Experience.builder().id(1).build().isRated());
    }

    @Test
    @DisplayName("摄入的物质名称不能为空，途径缺省为口服")
    void ingestionDefaults() {
        assertThrows(IllegalArgumentException.class, () -> ingestion(" ", T0));
        assertEquals(AdministrationRoute.ORAL, ingestion("LSD", T0).route());
    }

    @Test
    @DisplayName("设置时间范围后排除范围外和无日期的体验")
    void contextRangeFilter() {
        Experience inside = Experience.builder().id(1).date(T0).build();
        Experience outside = Experience.builder().id(2).date(T0.minusSeconds(86_400 * 30L)).build();
        Experience undated = Experience.builder().id(3).build();
        TimeRange range = new TimeRange(T0.minusSeconds(86_400), T0.plusSeconds(86_400));

        AnalyticsContext context = AnalyticsContext.builder()
                .experiences(List.of(inside, outside, undated))
                .timeRange(range)
                .build();

        assertEquals(List.of(inside), context.experiencesInRange());
        assertEquals(3, AnalyticsContext.of(List.of(inside, outside, undated)).experiencesInRange().size());
    }

    @Test
    @DisplayName("时间范围终点不能早于起点")
    void invalidTimeRange() {
        assertThrows(IllegalArgumentException.class, () -> new TimeRange(T0, T0.minusSeconds(1)));
        assertTrue(new TimeRange(T0, T0).contains(T0));
    }
}
