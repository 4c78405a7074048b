package com.skyfuse.weather.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.skyfuse.weather.model.AggregatedWeather;
import com.skyfuse.weather.model.WeatherCondition;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

public final class WeatherDtos {

    public static final String NOT_AVAILABLE = "N / A";
    static final String CONDITION_SEPARATOR = " or ";

    private static final DateTimeFormatter ISO_UTC = DateTimeFormatter
            .ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx")
            .withZone(ZoneOffset.UTC);

    /**
     * Consumer-facing rendering of an {@link AggregatedWeather}.
     */
    public record WeatherView(
            Double latitude,
            Double longitude,
            @JsonProperty("last_update") String lastUpdate,
            @JsonProperty("temp_c") String tempC,
            @JsonProperty("weather_condition") String weatherCondition
    ) {

        public static WeatherView from(AggregatedWeather weather) {
            return new WeatherView(
                    weather.latitude(),
                    weather.longitude(),
                    isoUtc(weather.lastUpdateEpoch()),
                    formatTemperature(weather.tempC()),
                    joinConditions(weather.conditions())
            );
        }
    }

    public record WeatherResponse(
            String requestId,
            String city,
            WeatherView weather,
            @JsonProperty("last_access") String lastAccess,
            @JsonProperty("recent_cities") List<String> recentCities
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ErrorResponse(
            String requestId,
            String error,
            String message,
            String details,
            @JsonProperty("last_access") String lastAccess,
            @JsonProperty("recent_cities") List<String> recentCities
    ) {

        public ErrorResponse(String requestId, String error, String message, String details) {
            this(requestId, error, message, details, null, null);
        }
    }

    public static String isoUtc(long epochSeconds) {
        return ISO_UTC.format(Instant.ofEpochSecond(epochSeconds));
    }

    public static String isoUtcOrNotAvailable(Long epochSeconds) {
        return epochSeconds == null ? NOT_AVAILABLE : isoUtc(epochSeconds);
    }

    // Rounds the exact binary value, ties to even: 2.675 is stored as 2.67499... and gives "2.67".
    static String formatTemperature(Double tempC) {
        if (tempC == null) return NOT_AVAILABLE;
        return new BigDecimal(tempC).setScale(2, RoundingMode.HALF_EVEN).toPlainString();
    }

    static String joinConditions(List<WeatherCondition> conditions) {
        if (conditions == null || conditions.isEmpty()) return NOT_AVAILABLE;
        return conditions.stream()
                .map(WeatherCondition::label)
                .collect(Collectors.joining(CONDITION_SEPARATOR));
    }

    private WeatherDtos() {}
}
