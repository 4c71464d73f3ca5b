package com.sensor.etl.extract;

import com.sensor.common.model.RawReading;

import java.util.List;

/**
 * Readings produced by the extract step, in source order, and where they came from.
 */
public record ExtractionResult(
    List<RawReading> readings,
    boolean synthetic,
    String source
) {
    public ExtractionResult {
        readings = List.copyOf(readings);
    }

    public static ExtractionResult fromSource(List<RawReading> readings, String source) {
        return new ExtractionResult(readings, false, source);
    }

    public static ExtractionResult synthetic(List<RawReading> readings) {
        return new ExtractionResult(readings, true, "synthetic");
    }

    public int size() {
        return readings.size();
    }
}
