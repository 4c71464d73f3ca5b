package com.sensor.common.store;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and statement limits applied by every store adapter.
 */
public record StoreSettings(
    Duration connectTimeout,
    Duration queryTimeout,
    int poolSize,
    int batchSize
) {
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_QUERY_TIMEOUT = Duration.ofSeconds(30);
    public static final int DEFAULT_POOL_SIZE = 5;
    public static final int DEFAULT_BATCH_SIZE = 500;

    public StoreSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(queryTimeout, "queryTimeout");
        if (connectTimeout.isNegative() || connectTimeout.isZero()) {
            throw new IllegalArgumentException("connectTimeout must be positive");
        }
        if (queryTimeout.isNegative() || queryTimeout.isZero()) {
            throw new IllegalArgumentException("queryTimeout must be positive");
        }
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be at least 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
    }

    public static StoreSettings defaults() {
        return new StoreSettings(DEFAULT_CONNECT_TIMEOUT, DEFAULT_QUERY_TIMEOUT, DEFAULT_POOL_SIZE, DEFAULT_BATCH_SIZE);
    }

    /**
     * Query timeout in whole seconds as JDBC expects it, never below one.
     */
    public int queryTimeoutSeconds() {
        return (int) Math.max(1, queryTimeout.toSeconds());
    }
}
