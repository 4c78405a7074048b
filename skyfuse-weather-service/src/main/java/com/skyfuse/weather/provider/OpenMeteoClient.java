package com.skyfuse.weather.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import static com.skyfuse.weather.provider.WeatherApiClient.doubleOrNull;
import static com.skyfuse.weather.provider.WeatherApiClient.stripTrailingSlash;
import static com.skyfuse.weather.provider.WeatherApiClient.textOrNull;

/**
 * Client for the Open-Meteo forecast API (https://open-meteo.com/en/docs), queried by coordinates.
 * Conditions come back as WMO weather codes rather than text.
 */
@Component
public class OpenMeteoClient {

    private final String baseUrl;
    private final long timeoutMs;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public OpenMeteoClient(@Value("${skyfuse.external.open-meteo.base-url:https://api.open-meteo.com}") String baseUrl,
                           @Value("${skyfuse.external.open-meteo.timeout-ms:5000}") long timeoutMs) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.timeoutMs = timeoutMs;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(timeoutMs))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @param time provider-local timestamp in {@code yyyy-MM-dd'T'HH:mm} form, without zone
     */
    public record OpenMeteoObservation(
            Double latitude,
            Double longitude,
            String time,
            Double tempC,
            Integer weatherCode
    ) implements ProviderObservation {

        @Override
        public ProviderKind kind() {
            return ProviderKind.OPEN_METEO;
        }
    }

    public OpenMeteoObservation fetchCurrent(double latitude, double longitude) {
        String url = baseUrl + "/v1/forecast"
                + "?latitude=" + latitude
                + "&longitude=" + longitude
                + "&current_weather=true";

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMillis(timeoutMs))
                .header("Accept", "application/json")
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() / 100 != 2) {
                throw new OpenMeteoRequestException("Open-Meteo returned status " + response.statusCode());
            }
            return parseObservation(response.body());
        } catch (IOException e) {
            throw new OpenMeteoRequestException("Open-Meteo request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OpenMeteoRequestException("Open-Meteo request interrupted", e);
        }
    }

    private OpenMeteoObservation parseObservation(String body) throws IOException {
        JsonNode root = objectMapper.readTree(body);
        JsonNode current = root.path("current_weather");
        return new OpenMeteoObservation(
                doubleOrNull(root.path("latitude")),
                doubleOrNull(root.path("longitude")),
                textOrNull(current.path("time")),
                doubleOrNull(current.path("temperature")),
                current.path("weathercode").isNumber() ? current.path("weathercode").asInt() : null
        );
    }
}
