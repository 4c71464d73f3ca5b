package com.sensor.etl.extract;

/**
 * The configured source file is missing, unreadable, lacks a required column or yields no valid row.
 */
public class SourceUnavailableException extends Exception {

    public SourceUnavailableException(String message) {
        super(message);
    }

    public SourceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
