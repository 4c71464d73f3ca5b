package com.sensor.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensor.common.dto.kpi.KpiSnapshot;
import com.sensor.common.dto.trend.TrendSeries;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * KPIs and trends of the same selection in one payload, with the covered time span.
 */
public record SummaryResponse(
    @JsonProperty("kpis")
    KpiSnapshot kpis,

    @JsonProperty("trends")
    TrendSeries trends,

    @JsonProperty("date_range")
    DateRange dateRange,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    /**
     * First and last reading timestamps; both null when the selection is empty.
     */
    public record DateRange(
        @JsonProperty("start")
        LocalDateTime start,

        @JsonProperty("end")
        LocalDateTime end
    ) {
        public static DateRange of(TrendSeries trends) {
            if (trends.isEmpty()) {
                return new DateRange(null, null);
            }
            return new DateRange(trends.timestamps().get(0), trends.timestamps().get(trends.recordCount() - 1));
        }
    }
}
