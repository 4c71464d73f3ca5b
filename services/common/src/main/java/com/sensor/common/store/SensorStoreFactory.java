package com.sensor.common.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Builds the store adapter matching a connection target, with a HikariCP pool underneath.
 */
@Slf4j
public final class SensorStoreFactory {

    private static final int MIN_CONNECT_TIMEOUT_MS = 250;

    private SensorStoreFactory() {}

    public static SensorStore open(String connectionTarget, StoreSettings settings) {
        return open(StoreTarget.parse(connectionTarget), settings);
    }

    public static SensorStore open(StoreTarget target, StoreSettings settings) {
        log.info("Opening {} store: {}", target.profile().getValue(), target);

        if (target instanceof StoreTarget.FileEmbedded file) {
            return new EmbeddedFileSensorStore(embeddedDataSource(file, settings), settings);
        }
        if (target instanceof StoreTarget.RelationalServer server) {
            return new RelationalSensorStore(
                    serverDataSource(target.profile(), server.jdbcUrl(), server.username(), server.password(), settings),
                    settings);
        }
        if (target instanceof StoreTarget.TimeSeriesOptimized server) {
            return new TimeSeriesSensorStore(
                    serverDataSource(target.profile(), server.jdbcUrl(), server.username(), server.password(), settings),
                    settings);
        }
        throw new IllegalArgumentException("Unsupported store target: " + target);
    }

    private static HikariDataSource embeddedDataSource(StoreTarget.FileEmbedded target, StoreSettings settings) {
        Path parent = target.path().toAbsolutePath().getParent();
        if (parent != null) {
            try {
                Files.createDirectories(parent);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot create directory for SQLite file " + target.path(), e);
            }
        }

        HikariConfig config = baseConfig(StoreProfile.FILE_EMBEDDED, settings);
        config.setJdbcUrl(target.jdbcUrl());
        // WAL lets readers keep reading the last committed table while a load is running
        config.addDataSourceProperty("journal_mode", "WAL");
        config.addDataSourceProperty("busy_timeout", String.valueOf(settings.queryTimeout().toMillis()));
        return new HikariDataSource(config);
    }

    private static HikariDataSource serverDataSource(StoreProfile profile, String jdbcUrl, String username,
                                                     String password, StoreSettings settings) {
        HikariConfig config = baseConfig(profile, settings);
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.addDataSourceProperty("connectTimeout", String.valueOf(Math.max(1, settings.connectTimeout().toSeconds())));
        config.addDataSourceProperty("ApplicationName", "sensor-analytics");
        return new HikariDataSource(config);
    }

    private static HikariConfig baseConfig(StoreProfile profile, StoreSettings settings) {
        HikariConfig config = new HikariConfig();
        config.setPoolName("sensor-store-" + profile.getValue());
        config.setMaximumPoolSize(settings.poolSize());
        config.setMinimumIdle(0);
        config.setConnectionTimeout(Math.max(MIN_CONNECT_TIMEOUT_MS, settings.connectTimeout().toMillis()));
        // do not fail at construction time, connectivity errors surface per operation instead
        config.setInitializationFailTimeout(-1);
        return config;
    }
}
