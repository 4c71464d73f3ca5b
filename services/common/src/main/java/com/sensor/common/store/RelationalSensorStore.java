package com.sensor.common.store;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;

/**
 * PostgreSQL-backed store on a pooled data source.
 * TRUNCATE is transactional in PostgreSQL, so concurrent readers block until the new content
 * is committed and never observe an empty or half-written table.
 */
public class RelationalSensorStore extends AbstractJdbcSensorStore {

    public RelationalSensorStore(DataSource dataSource, StoreSettings settings) {
        super(dataSource, settings);
    }

    @Override
    public StoreProfile profile() {
        return StoreProfile.RELATIONAL_SERVER;
    }

    @Override
    protected String timestampType() {
        return "TIMESTAMP";
    }

    @Override
    protected String doubleType() {
        return "DOUBLE PRECISION";
    }

    @Override
    protected String integerType() {
        return "INTEGER";
    }

    @Override
    protected String booleanType() {
        return "BOOLEAN";
    }

    @Override
    protected void bindTimestamp(PreparedStatement ps, int index, LocalDateTime timestamp) throws SQLException {
        ps.setObject(index, timestamp);
    }

    @Override
    protected LocalDateTime readTimestamp(ResultSet rs, String column) throws SQLException {
        return rs.getObject(column, LocalDateTime.class);
    }

    @Override
    protected String clearTableSql(String quotedTable) {
        return "TRUNCATE TABLE " + quotedTable;
    }
}
