package com.skyfuse.weather.service;

import com.skyfuse.weather.exception.UnsupportedObservationKindException;
import com.skyfuse.weather.model.CanonicalObservation;
import com.skyfuse.weather.model.ConditionClassifier;
import com.skyfuse.weather.model.WeatherCondition;
import com.skyfuse.weather.provider.OpenMeteoClient.OpenMeteoObservation;
import com.skyfuse.weather.provider.ProviderObservation;
import com.skyfuse.weather.provider.WeatherApiClient.WeatherApiObservation;
import com.skyfuse.weather.repository.WeatherCodebook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * Translates provider-specific observations into {@link CanonicalObservation}s.
 */
@Component
public class ObservationNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ObservationNormalizer.class);

    private static final DateTimeFormatter OPEN_METEO_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm");

    private final WeatherCodebook codebook;

    public ObservationNormalizer(WeatherCodebook codebook) {
        this.codebook = codebook;
    }

    public CanonicalObservation normalize(ProviderObservation observation) {
        if (observation == null || observation.kind() == null) {
            throw new UnsupportedObservationKindException("Observation carries no provider kind");
        }
        return switch (observation.kind()) {
            case WEATHER_API -> {
                WeatherApiObservation weatherApi = as(observation, WeatherApiObservation.class);
                yield toCanonical(weatherApi, weatherApi.lastUpdatedEpoch(), weatherApi.conditionText());
            }
            case OPEN_METEO -> {
                OpenMeteoObservation openMeteo = as(observation, OpenMeteoObservation.class);
                yield toCanonical(openMeteo, toEpochSeconds(openMeteo.time()), describe(openMeteo.weatherCode()));
            }
        };
    }

    private static <T extends ProviderObservation> T as(ProviderObservation observation, Class<T> type) {
        if (!type.isInstance(observation)) {
            throw new UnsupportedObservationKindException("No normalization for " + observation.kind()
                    + " observation of type " + observation.getClass().getName());
        }
        return type.cast(observation);
    }

    private static CanonicalObservation toCanonical(ProviderObservation observation, Long epoch, String conditionText) {
        WeatherCondition condition = conditionText == null || conditionText.isBlank()
                ? WeatherCondition.UNRECOGNIZED
                : ConditionClassifier.classify(conditionText);

        return new CanonicalObservation(
                observation.latitude(),
                observation.longitude(),
                epoch,
                observation.tempC(),
                condition
        );
    }

    private String describe(Integer weatherCode) {
        if (weatherCode == null) {
            log.warn("Open-Meteo observation carries no weather code");
            return null;
        }
        return codebook.describe(weatherCode).orElseGet(() -> {
            log.warn("Open-Meteo weather code {} is not in the codebook", weatherCode);
            return null;
        });
    }

    // Open-Meteo reports local time without an offset; it is taken as UTC.
    static Long toEpochSeconds(String time) {
        if (time == null || time.isBlank()) return null;
        try {
            return LocalDateTime.parse(time, OPEN_METEO_TIME).toEpochSecond(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Unparsable Open-Meteo time '{}': {}", time, e.getMessage());
            return null;
        }
    }
}
