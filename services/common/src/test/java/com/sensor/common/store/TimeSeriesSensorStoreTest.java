package com.sensor.common.store;

import com.sensor.common.model.ProcessedReading;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs against H2, which has no TimescaleDB extension. Without further setup the hypertable
 * declaration fails and the store falls back to plain relational behaviour; the catalog tests
 * stand in the extension's catalog view and function.
 */
public class TimeSeriesSensorStoreTest {

    private static final AtomicInteger DECLARATIONS = new AtomicInteger();

    private JdbcDataSource dataSource;
    private TimeSeriesSensorStore store;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        store = new TimeSeriesSensorStore(dataSource, StoreSettings.defaults());
        DECLARATIONS.set(0);
    }

    /**
     * H2 alias target for {@code create_hypertable}: registers the table in the catalog.
     */
    public static int createHypertable(Connection connection, String table, String timeColumn) throws SQLException {
        DECLARATIONS.incrementAndGet();
        try (PreparedStatement insert = connection.prepareStatement(
                "INSERT INTO timescaledb_information.hypertables (hypertable_name) VALUES (?)")) {
            insert.setString(1, table);
            insert.executeUpdate();
        }
        return 1;
    }

    private TimeSeriesSensorStore withHypertableCatalog() {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE SCHEMA timescaledb_information");
        jdbc.execute("CREATE TABLE timescaledb_information.hypertables (hypertable_name VARCHAR(128))");
        jdbc.execute("CREATE ALIAS create_hypertable FOR \""
                + TimeSeriesSensorStoreTest.class.getName() + ".createHypertable\"");
        // H2 has no named arguments
        return new TimeSeriesSensorStore(dataSource, StoreSettings.defaults()) {
            @Override
            protected String createHypertableSql(String table) {
                return "SELECT create_hypertable('" + table + "', 'timestamp')";
            }
        };
    }

    @Test
    void failedHypertableDeclarationShouldNotAbortTheLoad() {
        List<ProcessedReading> readings = StoreFixtures.hourlyReadings(6);

        LoadOutcome outcome = store.load(readings, "sensor_data");

        assertEquals(StoreProfile.TIME_SERIES_OPTIMIZED, outcome.profile());
        assertFalse(outcome.timePartitioned());
        assertEquals(6, outcome.rowsWritten());
        assertEquals(readings, store.query("sensor_data"));
    }

    @Test
    void shouldDeclareHypertableOnlyOnce() {
        TimeSeriesSensorStore timescale = withHypertableCatalog();

        LoadOutcome first = timescale.load(StoreFixtures.hourlyReadings(6), "sensor_data");
        LoadOutcome second = timescale.load(StoreFixtures.hourlyReadings(3), "sensor_data");

        assertTrue(first.timePartitioned());
        assertTrue(second.timePartitioned());
        assertEquals(1, DECLARATIONS.get());
        assertEquals(3, timescale.count("sensor_data"));
    }

    @Test
    void existingHypertableShouldSkipTheDeclaration() {
        TimeSeriesSensorStore timescale = withHypertableCatalog();
        new JdbcTemplate(dataSource).update(
                "INSERT INTO timescaledb_information.hypertables (hypertable_name) VALUES (?)", "sensor_data");

        LoadOutcome outcome = timescale.load(StoreFixtures.hourlyReadings(4), "sensor_data");

        assertTrue(outcome.timePartitioned());
        assertEquals(0, DECLARATIONS.get());
        assertEquals(4, outcome.rowsWritten());
    }

    @Test
    void shouldKeepReplaceSemantics() {
        store.load(StoreFixtures.hourlyReadings(6), "sensor_data");
        store.load(StoreFixtures.hourlyReadings(2), "sensor_data");

        assertEquals(2, store.count("sensor_data"));
    }
}
