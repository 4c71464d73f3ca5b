package com.sensor.common.store;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Backend families a connection target can select.
 */
public enum StoreProfile {
    FILE_EMBEDDED("file_embedded"),
    RELATIONAL_SERVER("relational_server"),
    TIME_SERIES_OPTIMIZED("time_series_optimized");

    private final String value;

    StoreProfile(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
