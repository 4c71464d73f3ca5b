package com.sensor.common.store;

import javax.sql.DataSource;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * SQLite-backed store. Timestamps are stored as fixed-width ISO-8601 text so that string
 * comparison orders them chronologically and the date range predicate stays index-friendly.
 */
public class EmbeddedFileSensorStore extends AbstractJdbcSensorStore {

    static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSSSS");

    public EmbeddedFileSensorStore(DataSource dataSource, StoreSettings settings) {
        super(dataSource, settings);
    }

    @Override
    public StoreProfile profile() {
        return StoreProfile.FILE_EMBEDDED;
    }

    @Override
    protected String timestampType() {
        return "TEXT";
    }

    @Override
    protected String doubleType() {
        return "REAL";
    }

    @Override
    protected String integerType() {
        return "INTEGER";
    }

    @Override
    protected String booleanType() {
        return "INTEGER";
    }

    @Override
    protected void bindTimestamp(PreparedStatement ps, int index, LocalDateTime timestamp) throws SQLException {
        ps.setString(index, TIMESTAMP_FORMAT.format(timestamp));
    }

    @Override
    protected LocalDateTime readTimestamp(ResultSet rs, String column) throws SQLException {
        return LocalDateTime.parse(rs.getString(column), TIMESTAMP_FORMAT);
    }

    // SQLite has no TRUNCATE; an unqualified DELETE uses the truncate optimization
    @Override
    protected String clearTableSql(String quotedTable) {
        return "DELETE FROM " + quotedTable;
    }
}
