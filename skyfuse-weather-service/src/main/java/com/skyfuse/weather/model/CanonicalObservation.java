package com.skyfuse.weather.model;

import java.util.List;

/**
 * One provider's reading translated into the internal schema.
 * Location, timestamp and temperature may be missing; the condition list never is.
 */
public record CanonicalObservation(
        Double latitude,
        Double longitude,
        Long lastUpdateEpoch,
        Double tempC,
        List<WeatherCondition> conditions
) {

    public CanonicalObservation {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("An observation needs at least one weather condition");
        }
        conditions = List.copyOf(conditions);
    }

    public CanonicalObservation(Double latitude, Double longitude, Long lastUpdateEpoch, Double tempC,
                                WeatherCondition condition) {
        this(latitude, longitude, lastUpdateEpoch, tempC, List.of(condition));
    }

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public boolean isUnrecognized() {
        return conditions.equals(List.of(WeatherCondition.UNRECOGNIZED));
    }
}
