package com.sensor.common.store;

import org.springframework.dao.DataAccessException;

import javax.sql.DataSource;

/**
 * TimescaleDB-backed store: a relational store whose table is declared as a hypertable
 * partitioned on {@code timestamp}.
 * <p>
 * The declaration runs only when the table is not already a hypertable. If it fails (extension
 * missing, insufficient privileges) the failure is logged and the store behaves as a plain
 * relational store.
 */
public class TimeSeriesSensorStore extends RelationalSensorStore {

    public TimeSeriesSensorStore(DataSource dataSource, StoreSettings settings) {
        super(dataSource, settings);
    }

    @Override
    public StoreProfile profile() {
        return StoreProfile.TIME_SERIES_OPTIMIZED;
    }

    @Override
    protected boolean prepareSchema(String table) {
        jdbcTemplate.execute(createTableSql(table));
        boolean hypertable = ensureHypertable(table);
        createIndexes(table);
        return hypertable;
    }

    boolean ensureHypertable(String table) {
        try {
            if (isHypertable(table)) {
                log.debug("Table {} is already a hypertable", table);
                return true;
            }
            jdbcTemplate.execute(createHypertableSql(table));
            log.info("Declared {} as a hypertable on timestamp", table);
            return true;
        } catch (DataAccessException e) {
            log.warn("Hypertable declaration for {} failed, continuing as a plain relational table: {}",
                    table, e.getMessage());
            return false;
        }
    }

    protected String createHypertableSql(String table) {
        // table name is validated against [A-Za-z_][A-Za-z0-9_]* before it gets here
        return "SELECT create_hypertable('" + table + "', 'timestamp', "
                + "if_not_exists => TRUE, migrate_data => TRUE)";
    }

    private boolean isHypertable(String table) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM timescaledb_information.hypertables WHERE hypertable_name = ?",
                Integer.class, table);
        return count != null && count > 0;
    }
}
