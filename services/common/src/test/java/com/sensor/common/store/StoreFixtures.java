package com.sensor.common.store;

import com.sensor.common.model.ProcessedReading;
import com.sensor.common.model.RawReading;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

final class StoreFixtures {

    static final LocalDateTime START = LocalDateTime.of(2024, 1, 15, 20, 0);

    private StoreFixtures() {}

    /**
     * Hourly readings starting at {@link #START}, so a batch of more than four rows spans two days.
     */
    static List<ProcessedReading> hourlyReadings(int count) {
        List<ProcessedReading> readings = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            readings.add(ProcessedReading.builder()
                    .from(RawReading.of(START.plusHours(i), 55.5 + i, 1000.25 - i, i))
                    .temperatureZscore(0.5 * i - 1.0)
                    .pressureZscore(-0.25 * i)
                    .temperatureAlert(i % 3 == 0)
                    .pressureAlert(i % 4 == 1)
                    .temperatureOutOfRange(i == 2)
                    .build());
        }
        return readings;
    }
}
