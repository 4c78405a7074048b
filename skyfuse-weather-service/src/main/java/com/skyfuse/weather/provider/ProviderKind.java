package com.skyfuse.weather.provider;

public enum ProviderKind {
    WEATHER_API,
    OPEN_METEO
}
