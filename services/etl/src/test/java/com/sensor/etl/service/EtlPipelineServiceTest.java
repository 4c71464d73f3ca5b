package com.sensor.etl.service;

import com.sensor.common.aggregate.KpiAggregator;
import com.sensor.common.config.AnomalyThresholds;
import com.sensor.common.exception.StoreUnavailableException;
import com.sensor.common.store.SensorStore;
import com.sensor.common.store.SensorStoreFactory;
import com.sensor.common.store.StoreProfile;
import com.sensor.common.store.StoreSettings;
import com.sensor.etl.export.ProcessedCsvExporter;
import com.sensor.etl.extract.CsvReadingExtractor;
import com.sensor.etl.extract.SyntheticReadingGenerator;
import com.sensor.etl.transform.ReadingCleaner;
import com.sensor.etl.transform.ReadingEnricher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EtlPipelineServiceTest {

    @TempDir
    Path tempDir;

    private SensorStore store;
    private SimpleMeterRegistry meterRegistry;
    private CsvReadingExtractor extractor;

    @BeforeEach
    void setUp() {
        store = SensorStoreFactory.open("sqlite:///" + tempDir.resolve("processed.db"), StoreSettings.defaults());
        meterRegistry = new SimpleMeterRegistry();
        SyntheticReadingGenerator generator = new SyntheticReadingGenerator(
                Clock.fixed(Instant.parse("2024-01-15T10:00:00Z"), ZoneOffset.UTC), new Random(42));
        extractor = new CsvReadingExtractor(generator, 100, Duration.ofHours(1), true);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    private EtlPipelineService service(SensorStore target, Path source, Path export) {
        return new EtlPipelineService(extractor, new ReadingCleaner(), new ReadingEnricher(),
                new ProcessedCsvExporter(), target, new KpiAggregator(), AnomalyThresholds.defaults(),
                source, export, "sensor_data", meterRegistry);
    }

    @Test
    void twoRunsShouldLeaveOnlyTheSecondRunsRows() throws IOException {
        Path source = tempDir.resolve("raw_sensor_data.csv");
        EtlPipelineService pipeline = service(store, source, tempDir.resolve("processed.csv"));

        PipelineRunResult first = pipeline.run();
        Files.writeString(source, """
                timestamp,temperature,pressure,uptime
                2024-02-01T00:00:00,50.0,1000.0,0
                2024-02-01T01:00:00,51.0,1001.0,1
                2024-02-01T02:00:00,52.0,1002.0,2
                """);
        PipelineRunResult second = pipeline.run();

        assertTrue(first.syntheticSource());
        assertEquals(100, first.load().rowsWritten());
        assertFalse(second.syntheticSource());
        assertEquals(100, second.load().rowsReplaced());
        assertEquals(3, store.count("sensor_data"));
        assertEquals(3, store.query("sensor_data").size());
        assertEquals(StoreProfile.FILE_EMBEDDED, second.load().profile());
    }

    @Test
    void shouldRecordMetricsAndExportCsv() throws IOException {
        Path source = tempDir.resolve("raw.csv");
        Files.writeString(source, """
                timestamp,temperature,pressure,uptime
                2024-02-01T00:00:00,50.0,1000.0,0
                2024-02-01T01:00:00,,1001.0,1
                garbage,52.0,1002.0,2
                2024-02-01T03:00:00,53.0,1003.0,3
                2024-02-01T04:00:00,54.0,1004.0,4
                """);
        Path export = tempDir.resolve("exports/processed.csv");

        PipelineRunResult result = service(store, source, export).run();

        assertEquals(4, result.recordsExtracted());
        assertTrue(result.exported());
        assertTrue(Files.exists(export));
        assertEquals(4, result.kpis().totalRecords());
        assertEquals(80.0, result.quality().dataQualityScore());
        assertEquals(4.0, meterRegistry.get("etl.records.extracted").counter().count());
        assertEquals(1.0, meterRegistry.get("etl.records.malformed").counter().count());
        assertEquals(1.0, meterRegistry.get("etl.values.imputed").counter().count());
        assertEquals(1L, meterRegistry.get("etl.load.latency").timer().count());
    }

    @Test
    void failedExportShouldNotFailTheRun() throws IOException {
        Path export = Files.createDirectories(tempDir.resolve("export-is-a-directory"));

        PipelineRunResult result = service(store, tempDir.resolve("raw.csv"), export).run();

        assertFalse(result.exported());
        assertEquals(100, store.count("sensor_data"));
    }

    @Test
    void unavailableStoreShouldPropagate() {
        SensorStore down = mock(SensorStore.class);
        when(down.profile()).thenReturn(StoreProfile.RELATIONAL_SERVER);
        when(down.load(anyList(), anyString()))
                .thenThrow(new StoreUnavailableException("Store unavailable during load", new RuntimeException()));

        EtlPipelineService pipeline = service(down, tempDir.resolve("raw.csv"), tempDir.resolve("out.csv"));

        StoreUnavailableException ex = assertThrows(StoreUnavailableException.class, pipeline::run);
        assertTrue(ex.isRetryable());
        assertFalse(Files.exists(tempDir.resolve("out.csv")));
    }
}
