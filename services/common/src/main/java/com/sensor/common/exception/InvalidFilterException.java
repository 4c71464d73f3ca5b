package com.sensor.common.exception;

/**
 * A caller supplied a filter that cannot be interpreted. Maps to a client error.
 */
public class InvalidFilterException extends RuntimeException {

    private final String rejectedValue;

    public InvalidFilterException(String rejectedValue, String message) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
