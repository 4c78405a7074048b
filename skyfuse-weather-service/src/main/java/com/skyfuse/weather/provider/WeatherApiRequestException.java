package com.skyfuse.weather.provider;

public class WeatherApiRequestException extends WeatherProviderException {

    public WeatherApiRequestException(String message) {
        super(message);
    }

    public WeatherApiRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
