package com.skyfuse.weather.service;

import com.skyfuse.weather.model.AggregatedWeather;
import com.skyfuse.weather.model.CanonicalObservation;
import com.skyfuse.weather.model.WeatherCondition;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Fuses the observations for one city into a single {@link AggregatedWeather}.
 *
 * Only observations with a location and a timestamp no older than {@link #STALE_CUTOFF_SECONDS}
 * take part. Among those:
 * <ul>
 *   <li>location is taken from the first one, in input order;</li>
 *   <li>the timestamp is the oldest one;</li>
 *   <li>temperature is the mean of the reported temperatures;</li>
 *   <li>conditions are the distinct first conditions, skipping unrecognized readings.</li>
 * </ul>
 */
@Component
public class WeatherAggregator {

    public static final long STALE_CUTOFF_SECONDS = 6 * 60 * 60;

    private final Clock clock;

    public WeatherAggregator(Clock clock) {
        this.clock = clock;
    }

    public Optional<AggregatedWeather> aggregate(List<CanonicalObservation> observations) {
        if (observations == null || observations.isEmpty()) return Optional.empty();

        long now = clock.instant().getEpochSecond();
        List<CanonicalObservation> usable = observations.stream()
                .filter(Objects::nonNull)
                .filter(observation -> isUsable(observation, now))
                .toList();

        if (usable.isEmpty()) return Optional.empty();

        long oldestEpoch = usable.stream()
                .mapToLong(CanonicalObservation::lastUpdateEpoch)
                .min()
                .getAsLong();

        OptionalDouble meanTemp = usable.stream()
                .map(CanonicalObservation::tempC)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();

        Set<WeatherCondition> conditions = new LinkedHashSet<>();
        for (CanonicalObservation observation : usable) {
            if (!observation.isUnrecognized()) {
                conditions.add(observation.conditions().get(0));
            }
        }

        CanonicalObservation first = usable.get(0);
        return Optional.of(new AggregatedWeather(
                first.latitude(),
                first.longitude(),
                oldestEpoch,
                meanTemp.isPresent() ? meanTemp.getAsDouble() : null,
                new ArrayList<>(conditions)
        ));
    }

    private static boolean isUsable(CanonicalObservation observation, long now) {
        return observation.hasLocation()
                && observation.lastUpdateEpoch() != null
                && now - observation.lastUpdateEpoch() <= STALE_CUTOFF_SECONDS;
    }
}
