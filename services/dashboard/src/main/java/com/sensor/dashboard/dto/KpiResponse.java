package com.sensor.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.sensor.common.dto.kpi.KpiSnapshot;

import java.time.Instant;

/**
 * KPI snapshot plus the time it was computed. The snapshot fields are inlined.
 */
public record KpiResponse(
    @JsonUnwrapped
    KpiSnapshot kpis,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public static KpiResponse of(KpiSnapshot kpis) {
        return new KpiResponse(kpis, Instant.now());
    }
}
