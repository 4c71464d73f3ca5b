package com.sensor.dashboard.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record HealthResponse(
    @JsonProperty("status")
    String status,

    @JsonProperty("database")
    String database,

    @JsonProperty("record_count")
    long recordCount,

    @JsonProperty("timestamp")
    Instant timestamp
) {
    public static final String HEALTHY = "healthy";
    public static final String DEGRADED = "degraded";

    public static HealthResponse connected(long recordCount) {
        return new HealthResponse(HEALTHY, "connected", recordCount, Instant.now());
    }

    public static HealthResponse storeError() {
        return new HealthResponse(DEGRADED, "error", 0, Instant.now());
    }
}
