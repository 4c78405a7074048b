package com.skyfuse.weather.exception;

public class CityWeatherNotFoundException extends CityWeatherFetchException {

    public CityWeatherNotFoundException(String city, Throwable cause) {
        super("Unknown city: " + city, cause);
    }
}
