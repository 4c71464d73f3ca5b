package com.sensor.common.store;

import com.sensor.common.model.ProcessedReading;

import java.time.LocalDate;
import java.util.List;

/**
 * Persists processed readings and reads them back for the serving layer.
 * <p>
 * Implementations must be safe to query from several threads while another process runs a load.
 * Connectivity problems and timeouts surface as
 * {@link com.sensor.common.exception.StoreUnavailableException}; any other database failure as
 * {@link com.sensor.common.exception.StoreException}.
 */
public interface SensorStore extends AutoCloseable {

    StoreProfile profile();

    /**
     * Replaces the whole content of {@code tableName} with {@code readings} in one transaction,
     * creating the table and its indexes first if needed.
     *
     * @throws IllegalArgumentException if {@code readings} is empty or the table name is invalid
     */
    LoadOutcome load(List<ProcessedReading> readings, String tableName);

    /**
     * Returns the rows of {@code tableName} in ascending timestamp order, restricted to one
     * calendar day when {@code dateFilter} is non-null. A missing table yields an empty list.
     */
    List<ProcessedReading> query(String tableName, LocalDate dateFilter);

    default List<ProcessedReading> query(String tableName) {
        return query(tableName, null);
    }

    /**
     * Number of rows in {@code tableName}, 0 if the table does not exist.
     */
    long count(String tableName);

    @Override
    void close();
}
