package com.sensor.etl.quality;

import com.sensor.common.model.SensorColumn;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Collects the degraded-data conditions of one pipeline run.
 * <p>
 * Not thread-safe; each run creates its own report.
 */
public class DataQualityReport {

    private final List<DataIssue> issues = new ArrayList<>();
    private final Map<SensorColumn, Integer> imputed = new EnumMap<>(SensorColumn.class);
    private final Map<SensorColumn, Integer> outliers = new EnumMap<>(SensorColumn.class);

    private long rowsRead;
    private long validRows;

    public void record(DataIssue issue) {
        issues.add(issue);
    }

    public void recordRows(long read, long valid) {
        this.rowsRead = read;
        this.validRows = valid;
    }

    public void recordImputed(SensorColumn column, int count) {
        imputed.merge(column, count, Integer::sum);
    }

    public void recordOutliers(SensorColumn column, int count) {
        outliers.merge(column, count, Integer::sum);
    }

    public List<DataIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    public long count(DataIssueType type) {
        return issues.stream().filter(issue -> issue.type() == type).count();
    }

    public boolean has(DataIssueType type, SensorColumn column) {
        return issues.stream().anyMatch(issue -> issue.type() == type && issue.column() == column);
    }

    public int getImputed(SensorColumn column) {
        return imputed.getOrDefault(column, 0);
    }

    public int getTotalImputed() {
        return imputed.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int getOutliers(SensorColumn column) {
        return outliers.getOrDefault(column, 0);
    }

    public int getTotalOutliers() {
        return outliers.values().stream().mapToInt(Integer::intValue).sum();
    }

    public long getRowsRead() {
        return rowsRead;
    }

    public long getValidRows() {
        return validRows;
    }

    /**
     * Percentage of read rows that parsed into a valid reading; 0 when nothing was read.
     */
    public double dataQualityScore() {
        if (rowsRead == 0) {
            return 0.0;
        }
        return validRows * 100.0 / rowsRead;
    }

    @Override
    public String toString() {
        return "DataQualityReport{rowsRead=" + rowsRead + ", validRows=" + validRows
                + ", imputed=" + imputed + ", outliers=" + outliers + ", issues=" + issues.size() + "}";
    }
}
