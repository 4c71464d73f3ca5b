package com.sensor.etl.extract;

import com.sensor.common.model.RawReading;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces a plausible industrial sensor series when no source data is available.
 * <p>
 * Temperature follows a 24-step cycle around 60 °C, pressure a 12-step cycle around 1000 hPa,
 * both with uniform noise and clamped to the physical range. Uptime counts steps. About 5% of
 * points get a spike on one of the two columns. The series ends at the current hour.
 */
@Slf4j
public class SyntheticReadingGenerator {

    static final double SPIKE_PROBABILITY = 0.05;

    private final Clock clock;
    private final Random random;

    public SyntheticReadingGenerator(Clock clock, Random random) {
        this.clock = clock;
        this.random = random;
    }

    public List<RawReading> generate(int rows, Duration interval) {
        if (rows <= 0) {
            throw new IllegalArgumentException("rows must be positive, got " + rows);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive, got " + interval);
        }

        log.info("Generating {} synthetic readings at {} intervals", rows, interval);
        LocalDateTime end = LocalDateTime.now(clock).truncatedTo(ChronoUnit.HOURS);
        LocalDateTime start = end.minus(interval.multipliedBy(rows - 1L));

        List<RawReading> readings = new ArrayList<>(rows);
        for (int i = 0; i < rows; i++) {
            double temperature = clamp(60 + 20 * Math.sin(2 * Math.PI * i / 24) + uniform(-10, 10), 20, 100);
            double pressure = clamp(1000 + 50 * Math.sin(2 * Math.PI * i / 12) + uniform(-20, 20), 900, 1100);

            if (random.nextDouble() < SPIKE_PROBABILITY) {
                if (random.nextBoolean()) {
                    temperature += random.nextBoolean() ? 30 : -30;
                } else {
                    pressure += random.nextBoolean() ? 100 : -100;
                }
            }

            readings.add(RawReading.of(start.plus(interval.multipliedBy(i)),
                    round2(temperature), round2(pressure), i));
        }
        return readings;
    }

    private double uniform(double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
