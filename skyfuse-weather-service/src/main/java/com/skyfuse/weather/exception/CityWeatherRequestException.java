package com.skyfuse.weather.exception;

/**
 * The primary weather provider could not be reached or answered with an error.
 */
public class CityWeatherRequestException extends CityWeatherFetchException {

    public CityWeatherRequestException(String city, Throwable cause) {
        super("Primary weather provider failed for " + city + ": " + cause.getMessage(), cause);
    }
}
