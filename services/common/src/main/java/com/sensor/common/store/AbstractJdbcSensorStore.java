package com.sensor.common.store;

import com.sensor.common.exception.StoreException;
import com.sensor.common.exception.StoreUnavailableException;
import com.sensor.common.filter.DateFilter;
import com.sensor.common.model.ProcessedReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * JDBC plumbing shared by all backends: schema DDL, replace-load in a single transaction,
 * ordered range queries and translation of Spring's {@link DataAccessException} hierarchy into
 * the store exceptions.
 * <p>
 * Subclasses supply the column types and the timestamp binding of their engine.
 */
public abstract class AbstractJdbcSensorStore implements SensorStore {

    private static final Pattern TABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]{0,62}");

    static final String COLUMNS = String.join(", ",
            "\"timestamp\"", "\"temperature\"", "\"pressure\"", "\"uptime\"",
            "\"hour\"", "\"day_of_week\"", "\"month\"",
            "\"temperature_zscore\"", "\"pressure_zscore\"",
            "\"temperature_alert\"", "\"pressure_alert\"",
            "\"temperature_out_of_range\"", "\"pressure_out_of_range\"");

    protected final Logger log = LoggerFactory.getLogger(getClass());

    protected final DataSource dataSource;
    protected final JdbcTemplate jdbcTemplate;
    protected final StoreSettings settings;
    private final TransactionTemplate transactionTemplate;

    protected AbstractJdbcSensorStore(DataSource dataSource, StoreSettings settings) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.jdbcTemplate = new JdbcTemplate(dataSource);
        this.jdbcTemplate.setQueryTimeout(settings.queryTimeoutSeconds());
        this.transactionTemplate = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.transactionTemplate.setTimeout(settings.queryTimeoutSeconds());
    }

    // Engine-specific hooks

    protected abstract String timestampType();

    protected abstract String doubleType();

    protected abstract String integerType();

    protected abstract String booleanType();

    protected abstract void bindTimestamp(PreparedStatement ps, int index, LocalDateTime timestamp) throws SQLException;

    protected abstract LocalDateTime readTimestamp(ResultSet rs, String column) throws SQLException;

    /**
     * Statement removing every row of the table inside the load transaction.
     */
    protected abstract String clearTableSql(String quotedTable);

    /**
     * Creates the table and its indexes if they do not exist. Runs outside the load transaction.
     *
     * @return true if the table is time-partitioned afterwards
     */
    protected boolean prepareSchema(String table) {
        jdbcTemplate.execute(createTableSql(table));
        createIndexes(table);
        return false;
    }

    protected void createIndexes(String table) {
        jdbcTemplate.execute(createIndexSql(table, "timestamp", "\"timestamp\""));
        jdbcTemplate.execute(createIndexSql(table, "uptime", "\"uptime\""));
        jdbcTemplate.execute(createIndexSql(table, "alerts", "\"temperature_alert\", \"pressure_alert\""));
    }

    @Override
    public LoadOutcome load(List<ProcessedReading> readings, String tableName) {
        String table = requireValidTableName(tableName);
        if (readings == null || readings.isEmpty()) {
            throw new IllegalArgumentException("Refusing to replace table " + table + " with an empty batch");
        }

        long started = System.nanoTime();
        log.info("Loading {} records into {} table {}", readings.size(), profile().getValue(), table);

        boolean timePartitioned = translate("prepare schema of " + table, () -> prepareSchema(table));
        Long previous = translate("replace contents of " + table,
                () -> transactionTemplate.execute(status -> replaceContents(table, readings)));

        Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
        log.info("Replaced {} rows with {} rows in {} in {} ms",
                previous, readings.size(), table, elapsed.toMillis());
        return new LoadOutcome(table, profile(), readings.size(), previous == null ? 0 : previous,
                timePartitioned, elapsed);
    }

    private long replaceContents(String table, List<ProcessedReading> readings) {
        String quoted = quote(table);
        Long previous = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + quoted, Long.class);
        jdbcTemplate.update(clearTableSql(quoted));
        jdbcTemplate.batchUpdate(insertSql(quoted), readings, settings.batchSize(), this::bindRow);
        return previous == null ? 0 : previous;
    }

    @Override
    public List<ProcessedReading> query(String tableName, LocalDate dateFilter) {
        String table = requireValidTableName(tableName);
        return translate("query " + table, () -> {
            if (!tableExists(table)) {
                log.warn("Table {} does not exist yet, run the ETL pipeline first", table);
                return List.of();
            }
            String sql = "SELECT " + COLUMNS + " FROM " + quote(table);
            List<ProcessedReading> rows;
            if (dateFilter == null) {
                rows = jdbcTemplate.query(sql + " ORDER BY \"timestamp\" ASC", (rs, rowNum) -> mapRow(rs));
            } else {
                rows = jdbcTemplate.query(
                        sql + " WHERE \"timestamp\" >= ? AND \"timestamp\" < ? ORDER BY \"timestamp\" ASC",
                        ps -> {
                            bindTimestamp(ps, 1, DateFilter.startOf(dateFilter));
                            bindTimestamp(ps, 2, DateFilter.endOf(dateFilter));
                        },
                        (rs, rowNum) -> mapRow(rs));
            }
            log.debug("Loaded {} records from {} (date filter: {})", rows.size(), table, dateFilter);
            return rows;
        });
    }

    @Override
    public long count(String tableName) {
        String table = requireValidTableName(tableName);
        return translate("count " + table, () -> {
            if (!tableExists(table)) {
                return 0L;
            }
            Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + quote(table), Long.class);
            return count == null ? 0L : count;
        });
    }

    @Override
    public void close() {
        if (dataSource instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("Failed to close {} data source: {}", profile().getValue(), e.getMessage());
            }
        }
    }

    protected boolean tableExists(String table) {
        Boolean exists = jdbcTemplate.execute((ConnectionCallback<Boolean>) connection -> {
            DatabaseMetaData metaData = connection.getMetaData();
            // current schema only; null (SQLite) means no schema filter
            try (ResultSet tables = metaData.getTables(null, connection.getSchema(), table, null)) {
                while (tables.next()) {
                    if (table.equals(tables.getString("TABLE_NAME"))) {
                        return true;
                    }
                }
                return false;
            }
        });
        return Boolean.TRUE.equals(exists);
    }

    protected String createTableSql(String table) {
        return "CREATE TABLE IF NOT EXISTS " + quote(table) + " ("
                + "\"timestamp\" " + timestampType() + " NOT NULL, "
                + "\"temperature\" " + doubleType() + ", "
                + "\"pressure\" " + doubleType() + ", "
                + "\"uptime\" " + doubleType() + ", "
                + "\"hour\" " + integerType() + ", "
                + "\"day_of_week\" " + integerType() + ", "
                + "\"month\" " + integerType() + ", "
                + "\"temperature_zscore\" " + doubleType() + ", "
                + "\"pressure_zscore\" " + doubleType() + ", "
                + "\"temperature_alert\" " + booleanType() + " NOT NULL, "
                + "\"pressure_alert\" " + booleanType() + " NOT NULL, "
                + "\"temperature_out_of_range\" " + booleanType() + " NOT NULL, "
                + "\"pressure_out_of_range\" " + booleanType() + " NOT NULL)";
    }

    protected String createIndexSql(String table, String suffix, String columns) {
        return "CREATE INDEX IF NOT EXISTS " + quote("idx_" + table + "_" + suffix)
                + " ON " + quote(table) + " (" + columns + ")";
    }

    private String insertSql(String quotedTable) {
        return "INSERT INTO " + quotedTable + " (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
    }

    private void bindRow(PreparedStatement ps, ProcessedReading reading) throws SQLException {
        bindTimestamp(ps, 1, reading.timestamp());
        ps.setDouble(2, reading.temperature());
        ps.setDouble(3, reading.pressure());
        ps.setDouble(4, reading.uptime());
        ps.setInt(5, reading.hour());
        ps.setInt(6, reading.dayOfWeek());
        ps.setInt(7, reading.month());
        ps.setDouble(8, reading.temperatureZscore());
        ps.setDouble(9, reading.pressureZscore());
        ps.setBoolean(10, reading.temperatureAlert());
        ps.setBoolean(11, reading.pressureAlert());
        ps.setBoolean(12, reading.temperatureOutOfRange());
        ps.setBoolean(13, reading.pressureOutOfRange());
    }

    private ProcessedReading mapRow(ResultSet rs) throws SQLException {
        return ProcessedReading.builder()
                .timestamp(readTimestamp(rs, "timestamp"))
                .temperature(readDouble(rs, "temperature"))
                .pressure(readDouble(rs, "pressure"))
                .uptime(readDouble(rs, "uptime"))
                .hour(rs.getInt("hour"))
                .dayOfWeek(rs.getInt("day_of_week"))
                .month(rs.getInt("month"))
                .temperatureZscore(readDouble(rs, "temperature_zscore"))
                .pressureZscore(readDouble(rs, "pressure_zscore"))
                .temperatureAlert(rs.getBoolean("temperature_alert"))
                .pressureAlert(rs.getBoolean("pressure_alert"))
                .temperatureOutOfRange(rs.getBoolean("temperature_out_of_range"))
                .pressureOutOfRange(rs.getBoolean("pressure_out_of_range"))
                .build();
    }

    private static double readDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? Double.NaN : value;
    }

    /**
     * Runs a store action, mapping connectivity failures and timeouts to
     * {@link StoreUnavailableException} and every other database error to {@link StoreException}.
     */
    protected <T> T translate(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (TransientDataAccessException | DataAccessResourceFailureException
                 | RecoverableDataAccessException | CannotCreateTransactionException e) {
            log.error("Store unavailable during {}: {}", operation, e.getMessage());
            throw new StoreUnavailableException("Store unavailable during " + operation, e);
        } catch (DataAccessException | TransactionException e) {
            log.error("Store failure during {}: {}", operation, e.getMessage());
            throw new StoreException("Store failure during " + operation, e);
        }
    }

    static String requireValidTableName(String tableName) {
        if (tableName == null || !TABLE_NAME.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
        return tableName;
    }

    static String quote(String identifier) {
        return "\"" + identifier + "\"";
    }
}
