package com.skyfuse.weather.provider;

public class WeatherApiCityNotFoundException extends WeatherProviderException {

    public WeatherApiCityNotFoundException(String city) {
        super("WeatherAPI has no location matching: " + city);
    }
}
