package com.insightframe.api.journal;

import lombok.Builder;

import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 一次体验记录，包含零到多次摄入
 *
 * @param id            记录ID
 * @param title         标题
 * @param date          体验日期，可为空
 * @param location      地点，可为空
 * @param overallRating 总体评分 (1..5)，可为空
 * @param notes         自由文本备注
 * @param ingestions    摄入列表，不为空
 */
@Builder(toBuilder = true)
public record Experience(long id,
                         String title,
                         Instant date,
                         String location,
                         Integer overallRating,
                         String notes,
                         List<Ingestion> ingestions) {

    public Experience {
        title = title == null ? "" : title;
        ingestions = ingestions == null ? List.of() : List.copyOf(ingestions);
        if (overallRating != null && (overallRating < 1 || overallRating > 5)) {
            throw new IllegalArgumentException("Rating must be within 1..5: " + overallRating);
        }
    }

    /**
     * 本次体验涉及的物质名称 (去重，保持出现顺序)
     */
    public Set<String> substanceNames() {
        Set<String> names = new LinkedHashSet<>();
        for (Ingestion ingestion : ingestions) {
            names.add(ingestion.substanceName());
        }
        return names;
    }

    public boolean isRated() {
        return overallRating != null;
    }

    /**
     * 体验日期；缺失时回退到最早的摄入时间
     */
    public Optional<Instant> effectiveDate() {
        if (date != null) {
            return Optional.of(date);
        }
        return ingestions.stream()
                .map(Ingestion::time)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder());
    }
}
