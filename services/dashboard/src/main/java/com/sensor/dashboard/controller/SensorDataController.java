package com.sensor.dashboard.controller;

import com.sensor.common.dto.trend.TrendSeries;
import com.sensor.dashboard.dto.HealthResponse;
import com.sensor.dashboard.dto.KpiResponse;
import com.sensor.dashboard.dto.SummaryResponse;
import com.sensor.dashboard.service.SensorDataService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Sensor Data", description = "KPIs and trend series of processed sensor readings")
public class SensorDataController {

    private static final String DATE_DESCRIPTION = "Restrict to one calendar day, format YYYY-MM-DD";

    private final SensorDataService sensorDataService;

    @GetMapping("/kpis")
    @Operation(summary = "Get KPIs", description = "Averages, ranges, alert counts and uptime, optionally for one day")
    public ResponseEntity<KpiResponse> getKpis(
            @Parameter(description = DATE_DESCRIPTION) @RequestParam(required = false) String date) {
        return ResponseEntity.ok(sensorDataService.getKpis(date));
    }

    @GetMapping("/trends")
    @Operation(summary = "Get trends", description = "Chart-ready time series ordered by timestamp")
    public ResponseEntity<TrendSeries> getTrends(
            @Parameter(description = DATE_DESCRIPTION) @RequestParam(required = false) String date) {
        return ResponseEntity.ok(sensorDataService.getTrends(date));
    }

    @GetMapping("/summary")
    @Operation(summary = "Get summary", description = "KPIs and trends of the same selection with its time span")
    public ResponseEntity<SummaryResponse> getSummary(
            @Parameter(description = DATE_DESCRIPTION) @RequestParam(required = false) String date) {
        return ResponseEntity.ok(sensorDataService.getSummary(date));
    }

    @GetMapping("/health")
    @Operation(summary = "Health check", description = "Store connectivity and record count; always HTTP 200")
    public ResponseEntity<HealthResponse> getHealth() {
        return ResponseEntity.ok(sensorDataService.getHealth());
    }
}
