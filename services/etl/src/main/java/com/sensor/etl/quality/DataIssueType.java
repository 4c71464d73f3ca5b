package com.sensor.etl.quality;

/**
 * Degraded-data conditions recorded during a pipeline run. None of them is fatal.
 */
public enum DataIssueType {
    SOURCE_UNAVAILABLE,
    MALFORMED_ROW,
    DEGENERATE_COLUMN
}
