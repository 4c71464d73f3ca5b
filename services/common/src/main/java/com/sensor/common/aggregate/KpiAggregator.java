package com.sensor.common.aggregate;

import com.sensor.common.dto.kpi.KpiSnapshot;
import com.sensor.common.dto.kpi.ValueRange;
import com.sensor.common.dto.trend.TrendSeries;
import com.sensor.common.filter.DateFilter;
import com.sensor.common.model.ProcessedReading;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.function.ToDoubleFunction;

/**
 * Computes KPI snapshots and trend series from processed readings.
 * <p>
 * Both operations optionally restrict the input to a single calendar day. Averages, ranges and
 * the uptime maximum only consider non-NaN values; a column without any valid value is reported
 * as zero and the snapshot carries {@code noData = true}, so NaN never leaves this class.
 * <p>
 * A pressure warning is a reading without a pressure alert whose pressure Z-score magnitude
 * exceeds the warning level (1.5 by default).
 */
public class KpiAggregator {

    public static final double DEFAULT_PRESSURE_WARNING_Z = 1.5;

    private final double pressureWarningZ;

    public KpiAggregator() {
        this(DEFAULT_PRESSURE_WARNING_Z);
    }

    public KpiAggregator(double pressureWarningZ) {
        this.pressureWarningZ = pressureWarningZ;
    }

    public KpiSnapshot computeKpis(List<ProcessedReading> readings, LocalDate dateFilter) {
        List<ProcessedReading> selected = select(readings, dateFilter);
        if (selected.isEmpty()) {
            return KpiSnapshot.empty(dateFilter);
        }

        DoubleSummaryStatistics temperature = summarize(selected, ProcessedReading::temperature);
        DoubleSummaryStatistics pressure = summarize(selected, ProcessedReading::pressure);
        DoubleSummaryStatistics uptime = summarize(selected, ProcessedReading::uptime);

        long temperatureAlerts = selected.stream().filter(ProcessedReading::temperatureAlert).count();
        long pressureAlerts = selected.stream().filter(ProcessedReading::pressureAlert).count();
        long pressureWarnings = selected.stream().filter(this::isPressureWarning).count();
        long alerts = selected.stream().filter(ProcessedReading::hasAlert).count();
        long outOfRange = selected.stream().filter(ProcessedReading::isOutOfRange).count();

        boolean noData = temperature.getCount() == 0 || pressure.getCount() == 0;

        return new KpiSnapshot(
                average(temperature),
                average(pressure),
                range(temperature),
                range(pressure),
                alerts,
                temperatureAlerts,
                pressureAlerts,
                pressureWarnings,
                outOfRange,
                uptime.getCount() == 0 ? 0.0 : uptime.getMax(),
                selected.size(),
                dateFilter,
                noData
        );
    }

    public KpiSnapshot computeKpis(List<ProcessedReading> readings) {
        return computeKpis(readings, null);
    }

    public TrendSeries prepareTrend(List<ProcessedReading> readings, LocalDate dateFilter) {
        List<ProcessedReading> selected = new ArrayList<>(select(readings, dateFilter));
        if (selected.isEmpty()) {
            return TrendSeries.empty(dateFilter);
        }
        // List.sort is stable, duplicates keep their input order
        selected.sort(Comparator.comparing(ProcessedReading::timestamp));

        List<LocalDateTime> timestamps = new ArrayList<>(selected.size());
        List<Double> temperatures = new ArrayList<>(selected.size());
        List<Double> pressures = new ArrayList<>(selected.size());
        List<Double> uptime = new ArrayList<>(selected.size());
        for (ProcessedReading reading : selected) {
            timestamps.add(reading.timestamp());
            temperatures.add(finiteOrZero(reading.temperature()));
            pressures.add(finiteOrZero(reading.pressure()));
            uptime.add(finiteOrZero(reading.uptime()));
        }
        return new TrendSeries(timestamps, temperatures, pressures, uptime, selected.size(), dateFilter);
    }

    public TrendSeries prepareTrend(List<ProcessedReading> readings) {
        return prepareTrend(readings, null);
    }

    private boolean isPressureWarning(ProcessedReading reading) {
        return !reading.pressureAlert() && Math.abs(reading.pressureZscore()) > pressureWarningZ;
    }

    private static List<ProcessedReading> select(List<ProcessedReading> readings, LocalDate dateFilter) {
        if (dateFilter == null) {
            return readings;
        }
        return readings.stream()
                .filter(reading -> DateFilter.matches(dateFilter, reading.timestamp()))
                .toList();
    }

    private static DoubleSummaryStatistics summarize(List<ProcessedReading> readings,
                                                     ToDoubleFunction<ProcessedReading> column) {
        return readings.stream()
                .mapToDouble(column)
                .filter(Double::isFinite)
                .summaryStatistics();
    }

    private static double average(DoubleSummaryStatistics stats) {
        return stats.getCount() == 0 ? 0.0 : stats.getAverage();
    }

    private static ValueRange range(DoubleSummaryStatistics stats) {
        return stats.getCount() == 0 ? ValueRange.zero() : new ValueRange(stats.getMin(), stats.getMax());
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0.0;
    }
}
