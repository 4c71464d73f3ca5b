package com.sensor.etl;

import com.sensor.common.exception.StoreException;
import com.sensor.etl.service.EtlPipelineService;
import com.sensor.etl.service.PipelineRunResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Sensor ETL batch job
 *
 * Extracts sensor readings from a CSV file (or synthesizes them), cleans and scores them,
 * replaces the contents of the configured table and exports the processed CSV. Exits with a
 * non-zero status when the run fails.
 */
@SpringBootApplication
@Slf4j
public class EtlApplication implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_STORE_UNAVAILABLE = 2;
    static final int EXIT_FAILURE = 1;

    private final EtlPipelineService pipelineService;
    private int exitCode;

    public EtlApplication(EtlPipelineService pipelineService) {
        this.pipelineService = pipelineService;
    }

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(EtlApplication.class, args);
        System.exit(SpringApplication.exit(context));
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            PipelineRunResult result = pipelineService.run();
            log.info("Run finished: {} records loaded into {}{}", result.load().rowsWritten(),
                    result.load().tableName(), result.syntheticSource() ? " from synthetic data" : "");
            exitCode = 0;
        } catch (StoreException e) {
            log.error("ETL pipeline failed{}: {}", e.isRetryable() ? " (store unavailable, retry later)" : "",
                    e.getMessage(), e);
            exitCode = e.isRetryable() ? EXIT_STORE_UNAVAILABLE : EXIT_FAILURE;
        } catch (RuntimeException e) {
            log.error("ETL pipeline failed with error: {}", e.getMessage(), e);
            exitCode = EXIT_FAILURE;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
