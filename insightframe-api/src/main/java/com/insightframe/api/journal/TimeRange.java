package com.insightframe.api.journal;

import java.time.Instant;

/**
 * 闭区间时间范围
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range bounds cannot be null");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end is before start: " + start + " > " + end);
        }
    }

    public boolean contains(Instant instant) {
        return instant != null && !instant.isBefore(start) && !instant.isAfter(end);
    }
}
