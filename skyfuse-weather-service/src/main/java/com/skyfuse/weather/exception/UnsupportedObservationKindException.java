package com.skyfuse.weather.exception;

/**
 * Raised when a provider observation type has no normalization path. Indicates a wiring bug, never bad data.
 */
public class UnsupportedObservationKindException extends RuntimeException {

    public UnsupportedObservationKindException(String message) {
        super(message);
    }
}
