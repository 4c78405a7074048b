package com.skyfuse.weather.exception;

/**
 * Weather for a city could not be produced.
 */
public class CityWeatherFetchException extends RuntimeException {

    public CityWeatherFetchException(String message) {
        super(message);
    }

    public CityWeatherFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
