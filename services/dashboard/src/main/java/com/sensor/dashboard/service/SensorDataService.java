package com.sensor.dashboard.service;

import com.sensor.common.aggregate.KpiAggregator;
import com.sensor.common.dto.kpi.KpiSnapshot;
import com.sensor.common.dto.trend.TrendSeries;
import com.sensor.common.exception.StoreException;
import com.sensor.common.filter.DateFilter;
import com.sensor.common.model.ProcessedReading;
import com.sensor.common.store.SensorStore;
import com.sensor.dashboard.config.DashboardProperties;
import com.sensor.dashboard.dto.HealthResponse;
import com.sensor.dashboard.dto.KpiResponse;
import com.sensor.dashboard.dto.SummaryResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Reads processed readings from the store and aggregates them per request.
 * <p>
 * The date filter is pushed down to the store; nothing is cached between requests.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SensorDataService {

    private final SensorStore sensorStore;
    private final KpiAggregator kpiAggregator;
    private final DashboardProperties properties;

    public KpiResponse getKpis(String date) {
        LocalDate filter = parseDate(date);
        return KpiResponse.of(kpiAggregator.computeKpis(load(filter), filter));
    }

    public TrendSeries getTrends(String date) {
        LocalDate filter = parseDate(date);
        return kpiAggregator.prepareTrend(load(filter), filter);
    }

    public SummaryResponse getSummary(String date) {
        LocalDate filter = parseDate(date);
        List<ProcessedReading> readings = load(filter);
        KpiSnapshot kpis = kpiAggregator.computeKpis(readings, filter);
        TrendSeries trends = kpiAggregator.prepareTrend(readings, filter);
        return new SummaryResponse(kpis, trends, SummaryResponse.DateRange.of(trends), Instant.now());
    }

    /**
     * Never throws for store problems: a failing store reports as degraded.
     */
    public HealthResponse getHealth() {
        try {
            return HealthResponse.connected(sensorStore.count(properties.getTableName()));
        } catch (StoreException e) {
            log.warn("Health check failed: {}", e.getMessage());
            return HealthResponse.storeError();
        }
    }

    private List<ProcessedReading> load(LocalDate filter) {
        List<ProcessedReading> readings = sensorStore.query(properties.getTableName(), filter);
        log.debug("Loaded {} readings from {} (date filter: {})", readings.size(), properties.getTableName(), filter);
        return readings;
    }

    private static LocalDate parseDate(String date) {
        return DateFilter.parse(date).orElse(null);
    }
}
