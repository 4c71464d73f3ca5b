package com.sensor.etl.config;

import com.sensor.common.aggregate.KpiAggregator;
import com.sensor.common.config.StoreProperties;
import com.sensor.common.store.SensorStore;
import com.sensor.common.store.SensorStoreFactory;
import com.sensor.etl.export.ProcessedCsvExporter;
import com.sensor.etl.extract.CsvReadingExtractor;
import com.sensor.etl.extract.SyntheticReadingGenerator;
import com.sensor.etl.service.EtlPipelineService;
import com.sensor.etl.transform.ReadingCleaner;
import com.sensor.etl.transform.ReadingEnricher;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.time.Clock;
import java.util.Random;

/**
 * Wires the pipeline stages and the store adapter from the bound properties.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public SyntheticReadingGenerator syntheticReadingGenerator(Clock clock, PipelineProperties properties) {
        Random random = properties.getSyntheticSeed() == null
                ? new Random()
                : new Random(properties.getSyntheticSeed());
        return new SyntheticReadingGenerator(clock, random);
    }

    @Bean
    public CsvReadingExtractor csvReadingExtractor(SyntheticReadingGenerator generator, PipelineProperties properties) {
        return new CsvReadingExtractor(generator, properties.getSyntheticRows(),
                properties.getSyntheticInterval(), properties.isPersistSyntheticSource());
    }

    @Bean
    public ReadingCleaner readingCleaner() {
        return new ReadingCleaner();
    }

    @Bean
    public ReadingEnricher readingEnricher() {
        return new ReadingEnricher();
    }

    @Bean
    public ProcessedCsvExporter processedCsvExporter() {
        return new ProcessedCsvExporter();
    }

    @Bean
    public KpiAggregator kpiAggregator() {
        return new KpiAggregator();
    }

    @Bean
    @Validated
    @ConfigurationProperties(prefix = "sensor.store")
    public StoreProperties storeProperties() {
        return new StoreProperties();
    }

    @Bean(destroyMethod = "close")
    public SensorStore sensorStore(StoreProperties properties) {
        return SensorStoreFactory.open(properties.toTarget(), properties.toSettings());
    }

    @Bean
    public EtlPipelineService etlPipelineService(CsvReadingExtractor extractor,
                                                 ReadingCleaner cleaner,
                                                 ReadingEnricher enricher,
                                                 ProcessedCsvExporter exporter,
                                                 SensorStore sensorStore,
                                                 KpiAggregator kpiAggregator,
                                                 PipelineProperties properties,
                                                 MeterRegistry meterRegistry) {
        return new EtlPipelineService(extractor, cleaner, enricher, exporter, sensorStore, kpiAggregator,
                properties.toThresholds(), Path.of(properties.getSourcePath()), Path.of(properties.getExportPath()),
                properties.getTableName(), meterRegistry);
    }
}
