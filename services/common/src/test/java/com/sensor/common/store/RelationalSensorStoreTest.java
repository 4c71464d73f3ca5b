package com.sensor.common.store;

import com.sensor.common.exception.StoreUnavailableException;
import com.sensor.common.model.ProcessedReading;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.sql.SQLTransientConnectionException;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RelationalSensorStoreTest {

    private static final String TABLE = "sensor_data";

    private JdbcDataSource dataSource;
    private RelationalSensorStore store;

    @BeforeEach
    void setUp() {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        store = new RelationalSensorStore(dataSource, StoreSettings.defaults());
    }

    @Test
    void loadThenQueryShouldRoundTrip() {
        List<ProcessedReading> readings = StoreFixtures.hourlyReadings(12);

        LoadOutcome outcome = store.load(readings, TABLE);

        assertEquals(StoreProfile.RELATIONAL_SERVER, outcome.profile());
        assertEquals(12, outcome.rowsWritten());
        assertEquals(readings, store.query(TABLE));
    }

    @Test
    void shouldCreateTimestampIndexIdempotently() {
        store.load(StoreFixtures.hourlyReadings(2), TABLE);
        store.load(StoreFixtures.hourlyReadings(2), TABLE);

        Integer indexes = new JdbcTemplate(dataSource).queryForObject(
                "SELECT COUNT(*) FROM INFORMATION_SCHEMA.INDEXES WHERE INDEX_NAME = 'idx_sensor_data_timestamp'",
                Integer.class);
        assertEquals(1, indexes);
    }

    @Test
    void repeatedLoadsShouldKeepOnlyTheLastBatch() {
        store.load(StoreFixtures.hourlyReadings(7), TABLE);
        store.load(StoreFixtures.hourlyReadings(4), TABLE);

        assertEquals(4, store.count(TABLE));
    }

    @Test
    void dateFilterShouldBePushedDownAsRange() {
        store.load(StoreFixtures.hourlyReadings(10), TABLE);

        List<ProcessedReading> rows = store.query(TABLE, LocalDate.of(2024, 1, 16));

        assertEquals(6, rows.size());
        assertEquals(StoreFixtures.START.plusHours(4), rows.get(0).timestamp());
    }

    @Test
    void sameNamedTableInAnotherSchemaShouldNotCount() {
        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        jdbc.execute("CREATE SCHEMA \"archive\"");
        jdbc.execute("CREATE TABLE \"archive\".\"sensor_data\" (\"timestamp\" TIMESTAMP)");

        assertTrue(store.query(TABLE).isEmpty());
        assertEquals(0, store.count(TABLE));
    }

    @Test
    void unreachableServerShouldSurfaceAsRetryableError() throws Exception {
        DataSource down = mock(DataSource.class);
        when(down.getConnection()).thenThrow(new SQLTransientConnectionException("Connection is not available"));
        RelationalSensorStore unreachable = new RelationalSensorStore(down, StoreSettings.defaults());

        StoreUnavailableException onQuery = assertThrows(StoreUnavailableException.class,
                () -> unreachable.query(TABLE));
        StoreUnavailableException onLoad = assertThrows(StoreUnavailableException.class,
                () -> unreachable.load(StoreFixtures.hourlyReadings(1), TABLE));
        assertThrows(StoreUnavailableException.class, () -> unreachable.count(TABLE));

        assertTrue(onQuery.isRetryable());
        assertTrue(onLoad.isRetryable());
    }
}
