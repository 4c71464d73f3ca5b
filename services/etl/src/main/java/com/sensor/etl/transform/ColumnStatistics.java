package com.sensor.etl.transform;

import com.sensor.common.model.RawReading;
import com.sensor.common.model.SensorColumn;

import java.util.Arrays;
import java.util.List;

/**
 * Batch statistics over one numeric column. All methods return NaN for an empty input.
 */
public final class ColumnStatistics {

    private ColumnStatistics() {}

    /**
     * Non-missing values of {@code column}, in reading order.
     */
    public static double[] validValues(List<RawReading> readings, SensorColumn column) {
        return readings.stream()
                .mapToDouble(column::read)
                .filter(value -> !Double.isNaN(value))
                .toArray();
    }

    /**
     * Linear-interpolation quantile: position {@code h = q (n - 1)} in the sorted values.
     */
    public static double quantile(double[] values, double q) {
        if (q < 0 || q > 1) {
            throw new IllegalArgumentException("quantile must be within [0, 1], got " + q);
        }
        if (values.length == 0) {
            return Double.NaN;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double index = q * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (index - lower);
    }

    public static double median(double[] values) {
        return quantile(values, 0.5);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    /**
     * Population standard deviation (divides by n).
     */
    public static double populationStdDev(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double mean = mean(values);
        double squares = 0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / values.length);
    }
}
