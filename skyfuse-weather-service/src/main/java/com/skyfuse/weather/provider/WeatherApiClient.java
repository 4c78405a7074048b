package com.skyfuse.weather.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Client for the WeatherAPI.com current conditions endpoint (https://www.weatherapi.com/docs/).
 * Looks a city up by name and reports its coordinates along with a textual condition.
 */
@Component
public class WeatherApiClient {

    private static final Logger log = LoggerFactory.getLogger(WeatherApiClient.class);

    static final int CITY_NOT_FOUND_ERROR_CODE = 1006;

    private final String baseUrl;
    private final String apiKey;
    private final long timeoutMs;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public WeatherApiClient(@Value("${skyfuse.external.weather-api.base-url:https://api.weatherapi.com}") String baseUrl,
                            @Value("${skyfuse.external.weather-api.key:}") String apiKey,
                            @Value("${skyfuse.external.weather-api.timeout-ms:5000}") long timeoutMs) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.apiKey = apiKey;
        this.timeoutMs = timeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    public record WeatherApiObservation(
            String cityName,
            String countryName,
            Double latitude,
            Double longitude,
            Long lastUpdatedEpoch,
            Double tempC,
            String conditionText,
            Integer conditionCode
    ) implements ProviderObservation {

        @Override
        public ProviderKind kind() {
            return ProviderKind.WEATHER_API;
        }
    }

    /**
     * Fetches the current weather for a city name such as "London" or "Tel Aviv".
     *
     * @throws WeatherApiCityNotFoundException if WeatherAPI cannot resolve the name
     * @throws WeatherApiRequestException on any transport, status or parsing failure
     */
    public WeatherApiObservation fetchCurrent(String city) {
        String url = baseUrl + "/v1/current.json"
                + "?key=" + URLEncoder.encode(apiKey, StandardCharsets.UTF_8)
                + "&q=" + URLEncoder.encode(city, StandardCharsets.UTF_8);

        HttpResponse<String> response = send(url);

        if (response.statusCode() / 100 != 2) {
            if (isCityNotFound(response.body())) {
                throw new WeatherApiCityNotFoundException(city);
            }
            throw new WeatherApiRequestException("WeatherAPI returned status " + response.statusCode());
        }

        return parseObservation(response.body());
    }

    private HttpResponse<String> send(String url) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(timeoutMs))
                .header("Accept", "application/json")
                .GET()
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new WeatherApiRequestException("WeatherAPI request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WeatherApiRequestException("WeatherAPI request interrupted", e);
        }
    }

    private boolean isCityNotFound(String body) {
        if (body == null || body.isBlank()) return false;
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            return error.path("code").asInt(-1) == CITY_NOT_FOUND_ERROR_CODE;
        } catch (IOException e) {
            log.debug("WeatherAPI error body is not JSON: {}", e.getMessage());
            return false;
        }
    }

    private WeatherApiObservation parseObservation(String body) {
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode location = root.path("location");
            JsonNode current = root.path("current");
            JsonNode condition = current.path("condition");

            return new WeatherApiObservation(
                    textOrNull(location.path("name")),
                    textOrNull(location.path("country")),
                    doubleOrNull(location.path("lat")),
                    doubleOrNull(location.path("lon")),
                    current.path("last_updated_epoch").isNumber() ? current.path("last_updated_epoch").asLong() : null,
                    doubleOrNull(current.path("temp_c")),
                    textOrNull(condition.path("text")),
                    condition.path("code").isNumber() ? condition.path("code").asInt() : null
            );
        } catch (IOException e) {
            throw new WeatherApiRequestException("WeatherAPI response could not be parsed", e);
        }
    }

    static Double doubleOrNull(JsonNode node) {
        return node.isNumber() ? node.asDouble() : null;
    }

    static String textOrNull(JsonNode node) {
        return node.isTextual() ? node.asText() : null;
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
