package com.skyfuse.weather.provider;

public class OpenMeteoRequestException extends WeatherProviderException {

    public OpenMeteoRequestException(String message) {
        super(message);
    }

    public OpenMeteoRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
