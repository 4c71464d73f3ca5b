package com.sensor.common.store;

import java.time.Duration;

/**
 * Result of a replace-load.
 *
 * @param rowsWritten    rows inserted by this load
 * @param rowsReplaced   rows the table held before the load
 * @param timePartitioned whether the table is a hypertable after the load
 */
public record LoadOutcome(
    String tableName,
    StoreProfile profile,
    int rowsWritten,
    long rowsReplaced,
    boolean timePartitioned,
    Duration elapsed
) {}
