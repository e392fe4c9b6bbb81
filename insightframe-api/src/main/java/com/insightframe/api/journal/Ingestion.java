package com.insightframe.api.journal;

import lombok.Builder;

import java.time.Instant;

/**
 * 单次摄入事件
 *
 * @param substanceName 物质名称
 * @param time          摄入时间，可为空
 * @param endTime       结束时间，可为空
 * @param route         给药途径
 * @param dose          剂量，可为空 (未知剂量)
 * @param units         剂量单位
 * @param notes         备注
 */
@Builder
public record Ingestion(String substanceName,
                        Instant time,
                        Instant endTime,
                        AdministrationRoute route,
                        Double dose,
                        String units,
                        String notes) {

    public Ingestion {
        if (substanceName == null || substanceName.isBlank()) {
            throw new IllegalArgumentException("Substance name cannot be blank");
        }
        route = route == null ? AdministrationRoute.ORAL : route;
    }

    public boolean hasDose() {
        return dose != null;
    }
}
