package com.sensor.etl.transform;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ColumnStatisticsTest {

    private static final double EPS = 1e-9;

    @Test
    void quantileShouldInterpolateLinearly() {
        double[] values = {28, 20, 240, 21, 27, 22, 26, 23, 25, 24};

        assertEquals(22.25, ColumnStatistics.quantile(values, 0.25), EPS);
        assertEquals(26.75, ColumnStatistics.quantile(values, 0.75), EPS);
        assertEquals(24.5, ColumnStatistics.median(values), EPS);
        assertEquals(20, ColumnStatistics.quantile(values, 0.0), EPS);
        assertEquals(240, ColumnStatistics.quantile(values, 1.0), EPS);
    }

    @Test
    void quantileShouldNotReorderInput() {
        double[] values = {3, 1, 2};

        ColumnStatistics.median(values);

        assertArrayEquals(new double[]{3, 1, 2}, values);
    }

    @Test
    void populationStdDevShouldDivideByN() {
        double[] values = {2, 4, 4, 4, 5, 5, 7, 9};

        assertEquals(5.0, ColumnStatistics.mean(values), EPS);
        assertEquals(2.0, ColumnStatistics.populationStdDev(values), EPS);
    }

    @Test
    void emptyInputShouldYieldNaN() {
        assertTrue(Double.isNaN(ColumnStatistics.median(new double[0])));
        assertTrue(Double.isNaN(ColumnStatistics.mean(new double[0])));
        assertTrue(Double.isNaN(ColumnStatistics.populationStdDev(new double[0])));
    }

    @Test
    void shouldRejectQuantileOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> ColumnStatistics.quantile(new double[]{1}, 1.5));
    }
}
