package com.sensor.etl.extract;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.sensor.common.model.RawReading;
import com.sensor.etl.quality.DataIssue;
import com.sensor.etl.quality.DataIssueType;
import com.sensor.etl.quality.DataQualityReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads raw readings from a delimited file with a {@code timestamp,temperature,pressure,uptime}
 * header, falling back to the synthetic generator when the file cannot be used.
 * <p>
 * Rows with an unparseable timestamp or number are skipped and counted. A record the tokenizer
 * cannot read, such as an unclosed quote, ends the read; rows before it are kept. Empty cells and
 * {@code nan}/{@code null} are missing values, not errors.
 */
@Slf4j
public class CsvReadingExtractor {

    static final List<String> REQUIRED_COLUMNS = List.of("timestamp", "temperature", "pressure", "uptime");

    private static final Set<String> MISSING_MARKERS = Set.of("", "nan", "null", "na", "n/a");

    private final CsvMapper csvMapper;
    private final SyntheticReadingGenerator generator;
    private final int syntheticRows;
    private final Duration syntheticInterval;
    private final boolean persistSyntheticSource;

    public CsvReadingExtractor(SyntheticReadingGenerator generator, int syntheticRows,
                               Duration syntheticInterval, boolean persistSyntheticSource) {
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
                .build();
        this.generator = generator;
        this.syntheticRows = syntheticRows;
        this.syntheticInterval = syntheticInterval;
        this.persistSyntheticSource = persistSyntheticSource;
    }

    /**
     * Extracts readings from {@code source}. Never fails for source problems: those are recorded
     * in the report and the synthetic generator runs once instead.
     */
    public ExtractionResult extract(Path source, DataQualityReport report) {
        try {
            List<RawReading> readings = read(source, report);
            log.info("Extracted {} readings from {}", readings.size(), source);
            return ExtractionResult.fromSource(readings, source.toString());
        } catch (SourceUnavailableException e) {
            log.warn("Source {} unavailable ({}), falling back to synthetic data", source, e.getMessage());
            report.record(DataIssue.of(DataIssueType.SOURCE_UNAVAILABLE, e.getMessage()));
        }

        List<RawReading> generated = generator.generate(syntheticRows, syntheticInterval);
        // a source that was read but yielded nothing keeps its own counts
        if (report.getRowsRead() == 0) {
            report.recordRows(generated.size(), generated.size());
        }
        if (persistSyntheticSource) {
            persist(generated, source);
        }
        return ExtractionResult.synthetic(generated);
    }

    List<RawReading> read(Path source, DataQualityReport report) throws SourceUnavailableException {
        if (!Files.isRegularFile(source)) {
            throw new SourceUnavailableException("file not found: " + source);
        }
        if (!Files.isReadable(source)) {
            throw new SourceUnavailableException("file not readable: " + source);
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<RawReading> readings = new ArrayList<>();
        long rowsRead = 0;

        try (MappingIterator<Map<String, String>> rows = csvMapper
                .readerForMapOf(String.class)
                .with(schema)
                .readValues(source.toFile())) {

            boolean hasRows = rows.hasNextValue();
            requireColumns((CsvSchema) rows.getParserSchema());
            if (!hasRows) {
                throw new SourceUnavailableException("file has a header but no rows: " + source);
            }

            while (true) {
                Map<String, String> row;
                try {
                    if (!rows.hasNextValue()) {
                        break;
                    }
                    row = rows.nextValue();
                } catch (JsonProcessingException | RuntimeJsonMappingException e) {
                    // the tokenizer cannot resync after a broken record, keep what was parsed so far
                    rowsRead++;
                    String message = "line " + (rowsRead + 1) + ": " + e.getMessage();
                    log.warn("Stopping at unreadable row, {}", message);
                    report.record(DataIssue.of(DataIssueType.MALFORMED_ROW, message));
                    break;
                }
                rowsRead++;
                try {
                    readings.add(parseRow(row));
                } catch (MalformedRowException e) {
                    // header is line 1
                    String message = "line " + (rowsRead + 1) + ": " + e.getMessage();
                    log.warn("Skipping malformed row at {}", message);
                    report.record(DataIssue.of(DataIssueType.MALFORMED_ROW, message));
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new SourceUnavailableException("cannot read " + source + ": " + e.getMessage(), e);
        }

        report.recordRows(rowsRead, readings.size());
        if (readings.isEmpty()) {
            throw new SourceUnavailableException("no valid rows in " + source + " (" + rowsRead + " malformed)");
        }
        if (readings.size() < rowsRead) {
            log.warn("Skipped {} of {} rows in {}", rowsRead - readings.size(), rowsRead, source);
        }
        return readings;
    }

    private static void requireColumns(CsvSchema header) throws SourceUnavailableException {
        List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (header == null || header.column(column) == null) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new SourceUnavailableException("missing required columns " + missing
                    + ", expected " + REQUIRED_COLUMNS);
        }
    }

    static RawReading parseRow(Map<String, String> row) throws MalformedRowException {
        return RawReading.of(
                parseTimestamp(row.get("timestamp")),
                parseNumber("temperature", row.get("temperature")),
                parseNumber("pressure", row.get("pressure")),
                parseNumber("uptime", row.get("uptime")));
    }

    /**
     * Accepts ISO-8601 local date-times with {@code T} or a space as separator, optional fractional
     * seconds, and offset or {@code Z} forms which are converted to UTC wall-clock time.
     */
    static LocalDateTime parseTimestamp(String value) throws MalformedRowException {
        if (value == null || value.isBlank()) {
            throw new MalformedRowException("missing timestamp");
        }
        String normalized = value.trim().replaceFirst(" ", "T");
        try {
            return LocalDateTime.parse(normalized);
        } catch (DateTimeParseException local) {
            try {
                return OffsetDateTime.parse(normalized).withOffsetSameInstant(ZoneOffset.UTC).toLocalDateTime();
            } catch (DateTimeParseException offset) {
                throw new MalformedRowException("unparseable timestamp '" + value + "'");
            }
        }
    }

    static double parseNumber(String column, String value) throws MalformedRowException {
        if (value == null || MISSING_MARKERS.contains(value.trim().toLowerCase(Locale.ROOT))) {
            return Double.NaN;
        }
        try {
            double parsed = Double.parseDouble(value.trim());
            return Double.isFinite(parsed) ? parsed : Double.NaN;
        } catch (NumberFormatException e) {
            throw new MalformedRowException("unparseable " + column + " '" + value + "'");
        }
    }

    private void persist(List<RawReading> readings, Path target) {
        CsvSchema schema = csvMapper.schemaFor(SourceRow.class).withHeader();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 SequenceWriter rows = csvMapper.writer(schema).writeValues(writer)) {
                for (RawReading reading : readings) {
                    rows.write(SourceRow.of(reading));
                }
            }
            log.info("Synthetic source data saved to {}", target);
        } catch (IOException e) {
            log.warn("Could not save synthetic source data to {}: {}", target, e.getMessage());
        }
    }

    @JsonPropertyOrder({"timestamp", "temperature", "pressure", "uptime"})
    record SourceRow(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("temperature") double temperature,
        @JsonProperty("pressure") double pressure,
        @JsonProperty("uptime") double uptime
    ) {
        static SourceRow of(RawReading reading) {
            return new SourceRow(DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(reading.timestamp()), reading.temperature(),
                    reading.pressure(), reading.uptime());
        }
    }

    static class MalformedRowException extends Exception {
        MalformedRowException(String message) {
            super(message);
        }
    }
}
