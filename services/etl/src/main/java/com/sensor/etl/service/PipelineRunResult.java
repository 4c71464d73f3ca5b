package com.sensor.etl.service;

import com.sensor.common.dto.kpi.KpiSnapshot;
import com.sensor.common.store.LoadOutcome;
import com.sensor.etl.quality.DataQualityReport;

import java.time.Duration;

/**
 * Outcome of one successful pipeline run.
 */
public record PipelineRunResult(
    int recordsExtracted,
    boolean syntheticSource,
    LoadOutcome load,
    KpiSnapshot kpis,
    DataQualityReport quality,
    boolean exported,
    Duration elapsed
) {}
