package com.sensor.dashboard;

import com.sensor.common.model.ProcessedReading;
import com.sensor.common.model.RawReading;
import com.sensor.common.store.SensorStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class SensorDashboardIntegrationTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 1, 15, 0, 0);

    @TempDir
    static Path workDir;

    @DynamicPropertySource
    static void storeProperties(DynamicPropertyRegistry registry) {
        registry.add("sensor.store.connection-target", () -> "sqlite:///" + workDir.resolve("processed.db"));
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private SensorStore sensorStore;

    @BeforeEach
    void loadReadings() {
        List<ProcessedReading> readings = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            readings.add(ProcessedReading.builder()
                    .from(RawReading.of(START.plusHours(i), 50.0 + i, 1000.0, i))
                    .temperatureAlert(i == 27)
                    .pressureAlert(i == 3)
                    .build());
        }
        sensorStore.load(readings, "sensor_data");
    }

    @Test
    void kpisForOneDayShouldOnlyCoverThatDay() throws Exception {
        mockMvc.perform(get("/api/kpis").param("date", "2024-01-16"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_records").value(6))
                .andExpect(jsonPath("$.alert_count").value(1))
                .andExpect(jsonPath("$.uptime_hours").value(29.0))
                .andExpect(jsonPath("$.date_filter").value("2024-01-16"));
    }

    @Test
    void kpisForDayWithoutDataShouldBeZeroed() throws Exception {
        mockMvc.perform(get("/api/kpis").param("date", "2024-02-01"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_records").value(0))
                .andExpect(jsonPath("$.avg_temp").value(0.0))
                .andExpect(jsonPath("$.no_data").value(true));
    }

    @Test
    void trendsShouldReturnAllReadingsInOrder() throws Exception {
        mockMvc.perform(get("/api/trends"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.timestamps", hasSize(30)))
                .andExpect(jsonPath("$.timestamps[0]").value("2024-01-15T00:00:00"))
                .andExpect(jsonPath("$.temperatures[29]").value(79.0))
                .andExpect(jsonPath("$.record_count").value(30));
    }

    @Test
    void summaryShouldCombineKpisTrendsAndRange() throws Exception {
        mockMvc.perform(get("/api/summary").param("date", "2024-01-15"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.kpis.total_records").value(24))
                .andExpect(jsonPath("$.trends.record_count").value(24))
                .andExpect(jsonPath("$.date_range.start").value("2024-01-15T00:00:00"))
                .andExpect(jsonPath("$.date_range.end").value("2024-01-15T23:00:00"));
    }

    @Test
    void healthShouldReportConnectedStore() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.database").value("connected"))
                .andExpect(jsonPath("$.record_count").value(30));
    }

    @Test
    void malformedDateShouldReturnBadRequest() throws Exception {
        mockMvc.perform(get("/api/trends").param("date", "yesterday"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400));
    }
}
