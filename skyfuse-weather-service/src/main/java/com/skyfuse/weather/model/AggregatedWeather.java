package com.skyfuse.weather.model;

import java.util.List;

/**
 * Weather for one city fused from every observation that survived filtering.
 * {@code conditions} holds each distinct recognized condition once and may be empty.
 */
public record AggregatedWeather(
        Double latitude,
        Double longitude,
        long lastUpdateEpoch,
        Double tempC,
        List<WeatherCondition> conditions
) {

    public AggregatedWeather {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }
}
