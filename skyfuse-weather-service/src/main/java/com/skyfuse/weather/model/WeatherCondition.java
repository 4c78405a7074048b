package com.skyfuse.weather.model;

/**
 * Provider-independent weather states. Ids are stable across releases; labels are for display only.
 */
public enum WeatherCondition {

    CLEAR(0, "Clear"),
    PARTIALLY_CLOUDY(1, "Partially Cloudy"),
    CLOUDY(2, "Cloudy"),
    DRIZZLE(3, "Drizzle"),
    LIGHT_RAIN(4, "Light Rain"),
    MODERATE_RAIN(5, "Moderate Rain"),
    HEAVY_RAIN(6, "Heavy Rain"),
    LIGHT_SNOW(7, "Light Snow"),
    MODERATE_SNOW(8, "Moderate Snow"),
    HEAVY_SNOW(9, "Heavy Snow"),
    OVERCAST(10, "Overcast"),
    MIST(11, "Mist"),
    FOG(12, "Fog"),
    UNRECOGNIZED(13, "Unrecognized");

    private final int id;
    private final String label;

    WeatherCondition(int id, String label) {
        this.id = id;
        this.label = label;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    public static WeatherCondition fromId(int id) {
        for (WeatherCondition condition : values()) {
            if (condition.id == id) return condition;
        }
        throw new IllegalArgumentException("Unknown weather condition id: " + id);
    }
}
