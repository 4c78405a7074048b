package com.skyfuse.weather.provider;

/**
 * Raw current-weather reading as returned by one provider client.
 */
public interface ProviderObservation {

    ProviderKind kind();

    Double latitude();

    Double longitude();

    Double tempC();
}
