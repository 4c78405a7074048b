package com.skyfuse.weather.service;

import com.skyfuse.weather.exception.CityWeatherFetchException;
import com.skyfuse.weather.exception.CityWeatherNotFoundException;
import com.skyfuse.weather.exception.CityWeatherRequestException;
import com.skyfuse.weather.model.AggregatedWeather;
import com.skyfuse.weather.model.CanonicalObservation;
import com.skyfuse.weather.provider.OpenMeteoClient;
import com.skyfuse.weather.provider.OpenMeteoRequestException;
import com.skyfuse.weather.provider.ProviderObservation;
import com.skyfuse.weather.provider.WeatherApiClient;
import com.skyfuse.weather.provider.WeatherApiClient.WeatherApiObservation;
import com.skyfuse.weather.provider.WeatherApiCityNotFoundException;
import com.skyfuse.weather.provider.WeatherApiRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches a city's current weather from WeatherAPI (required) and Open-Meteo (best effort)
 * and merges both into one record.
 */
@Service
public class WeatherService {

    private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

    private final WeatherApiClient weatherApi;
    private final OpenMeteoClient openMeteo;
    private final ObservationNormalizer normalizer;
    private final WeatherAggregator aggregator;

    public WeatherService(WeatherApiClient weatherApi,
                          OpenMeteoClient openMeteo,
                          ObservationNormalizer normalizer,
                          WeatherAggregator aggregator) {
        this.weatherApi = weatherApi;
        this.openMeteo = openMeteo;
        this.normalizer = normalizer;
        this.aggregator = aggregator;
    }

    /**
     * @throws CityWeatherNotFoundException if the primary provider does not know the city
     * @throws CityWeatherRequestException if the primary provider request fails
     * @throws CityWeatherFetchException if every observation was stale or incomplete
     */
    public AggregatedWeather fetchCityWeather(String city) {
        WeatherApiObservation primary;
        try {
            primary = weatherApi.fetchCurrent(city);
        } catch (WeatherApiCityNotFoundException e) {
            throw new CityWeatherNotFoundException(city, e);
        } catch (WeatherApiRequestException e) {
            throw new CityWeatherRequestException(city, e);
        }

        List<ProviderObservation> observations = new ArrayList<>();
        observations.add(primary);

        if (primary.latitude() != null && primary.longitude() != null) {
            try {
                observations.add(openMeteo.fetchCurrent(primary.latitude(), primary.longitude()));
            } catch (OpenMeteoRequestException e) {
                log.warn("Could not fetch Open-Meteo weather for {}: {}", city, e.getMessage());
            }
        }

        List<CanonicalObservation> normalized = observations.stream()
                .map(normalizer::normalize)
                .toList();

        return aggregator.aggregate(normalized)
                .orElseThrow(() -> new CityWeatherFetchException("All city weather data were filtered out"));
    }
}
