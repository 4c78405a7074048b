package com.skyfuse.weather.provider;

import com.skyfuse.weather.provider.WeatherApiClient.WeatherApiObservation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeatherApiClientTest {

    private static final String LONDON = """
            {
              "location": {"name": "London", "country": "United Kingdom", "lat": 51.52, "lon": -0.11},
              "current": {
                "last_updated_epoch": 1714564800,
                "temp_c": 14.0,
                "condition": {"text": "Partly cloudy", "code": 1003}
              }
            }
            """;

    @Test
    void parsesCurrentWeather() throws Exception {
        try (StubProviderServer server = StubProviderServer.start("/v1/current.json", 200, LONDON)) {
            WeatherApiClient client = new WeatherApiClient(server.baseUrl(), "secret", 2000);

            WeatherApiObservation observation = client.fetchCurrent("Tel Aviv");

            assertThat(observation.kind()).isEqualTo(ProviderKind.WEATHER_API);
            assertThat(observation.cityName()).isEqualTo("London");
            assertThat(observation.countryName()).isEqualTo("United Kingdom");
            assertThat(observation.latitude()).isEqualTo(51.52);
            assertThat(observation.longitude()).isEqualTo(-0.11);
            assertThat(observation.lastUpdatedEpoch()).isEqualTo(1_714_564_800L);
            assertThat(observation.tempC()).isEqualTo(14.0);
            assertThat(observation.conditionText()).isEqualTo("Partly cloudy");
            assertThat(observation.conditionCode()).isEqualTo(1003);
            assertThat(server.lastRequest().getRawQuery()).contains("key=secret").contains("q=Tel+Aviv");
        }
    }

    @Test
    void missingFields_areNull() throws Exception {
        try (StubProviderServer server = StubProviderServer.start("/v1/current.json", 200, "{}")) {
            WeatherApiObservation observation = new WeatherApiClient(server.baseUrl(), "k", 2000).fetchCurrent("x");

            assertThat(observation.latitude()).isNull();
            assertThat(observation.lastUpdatedEpoch()).isNull();
            assertThat(observation.conditionText()).isNull();
            assertThat(observation.conditionCode()).isNull();
        }
    }

    @Test
    void errorCode1006_isCityNotFound() throws Exception {
        String body = "{\"error\": {\"code\": 1006, \"message\": \"No matching location found.\"}}";
        try (StubProviderServer server = StubProviderServer.start("/v1/current.json", 400, body)) {
            WeatherApiClient client = new WeatherApiClient(server.baseUrl(), "k", 2000);

            assertThatThrownBy(() -> client.fetchCurrent("Atlantis"))
                    .isInstanceOf(WeatherApiCityNotFoundException.class);
        }
    }

    @Test
    void otherErrors_areRequestFailures() throws Exception {
        String body = "{\"error\": {\"code\": 2006, \"message\": \"API key is invalid.\"}}";
        try (StubProviderServer server = StubProviderServer.start("/v1/current.json", 401, body)) {
            WeatherApiClient client = new WeatherApiClient(server.baseUrl(), "k", 2000);

            assertThatThrownBy(() -> client.fetchCurrent("London"))
                    .isInstanceOf(WeatherApiRequestException.class)
                    .hasMessageContaining("401");
        }
    }

    @Test
    void nonJsonBody_isRequestFailure() throws Exception {
        try (StubProviderServer server = StubProviderServer.start("/v1/current.json", 200, "<html>oops</html>")) {
            WeatherApiClient client = new WeatherApiClient(server.baseUrl(), "k", 2000);

            assertThatThrownBy(() -> client.fetchCurrent("London"))
                    .isInstanceOf(WeatherApiRequestException.class);
        }
    }

    @Test
    void unreachableHost_isRequestFailure() {
        WeatherApiClient client = new WeatherApiClient("http://localhost:1/", "k", 500);

        assertThatThrownBy(() -> client.fetchCurrent("London"))
                .isInstanceOf(WeatherApiRequestException.class)
                .isInstanceOf(WeatherProviderException.class);
    }
}
