package com.sensor.etl.export;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.sensor.common.model.ProcessedReading;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes processed readings to a CSV file, one row per reading.
 */
@Slf4j
public class ProcessedCsvExporter {

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(ExportRow.class).withHeader();

    public void export(List<ProcessedReading> readings, Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             SequenceWriter rows = csvMapper.writer(schema).writeValues(writer)) {
            for (ProcessedReading reading : readings) {
                rows.write(ExportRow.of(reading));
            }
        }
        log.info("Exported {} processed readings to {}", readings.size(), target);
    }

    @JsonPropertyOrder({"timestamp", "temperature", "pressure", "uptime",
            "temperature_zscore", "pressure_zscore", "temperature_alert", "pressure_alert"})
    record ExportRow(
        @JsonProperty("timestamp") String timestamp,
        @JsonProperty("temperature") double temperature,
        @JsonProperty("pressure") double pressure,
        @JsonProperty("uptime") double uptime,
        @JsonProperty("temperature_zscore") double temperatureZscore,
        @JsonProperty("pressure_zscore") double pressureZscore,
        @JsonProperty("temperature_alert") boolean temperatureAlert,
        @JsonProperty("pressure_alert") boolean pressureAlert
    ) {
        static ExportRow of(ProcessedReading reading) {
            return new ExportRow(
                    DateTimeFormatter.ISO_LOCAL_DATE_TIME.format(reading.timestamp()),
                    reading.temperature(), reading.pressure(), reading.uptime(),
                    reading.temperatureZscore(), reading.pressureZscore(),
                    reading.temperatureAlert(), reading.pressureAlert());
        }
    }
}
