package com.sensor.common.exception;

/**
 * The store could not be reached or did not answer within the configured timeout.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause, true);
    }
}
