package com.skyfuse.weather.api;

import com.skyfuse.weather.config.ClockConfig;
import com.skyfuse.weather.controller.WeatherController;
import com.skyfuse.weather.exception.AccessLogException;
import com.skyfuse.weather.exception.CityWeatherFetchException;
import com.skyfuse.weather.exception.CityWeatherNotFoundException;
import com.skyfuse.weather.exception.CityWeatherRequestException;
import com.skyfuse.weather.exception.UnsupportedObservationKindException;
import com.skyfuse.weather.model.AggregatedWeather;
import com.skyfuse.weather.model.WeatherCondition;
import com.skyfuse.weather.service.AccessLogService;
import com.skyfuse.weather.service.AccessLogService.AccessRecord;
import com.skyfuse.weather.service.WeatherService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(controllers = WeatherController.class)
@Import(ClockConfig.class)
class WeatherControllerWebTest {

    private static final String IP = "127.0.0.1";

    @Autowired
    MockMvc mvc;

    @MockitoBean
    WeatherService weatherService;

    @MockitoBean
    AccessLogService accessLog;

    @BeforeEach
    void setUp() {
        when(accessLog.previousAccess(IP)).thenReturn(Optional.of(1_714_564_800L));
        when(accessLog.recordAccess(eq(IP), anyLong(), anyString()))
                .thenAnswer(inv -> new AccessRecord(inv.<Long>getArgument(1), List.of(inv.<String>getArgument(2), "Paris", "Oslo")));
    }

    @Test
    void getWeather_returns200_andJson() throws Exception {
        when(weatherService.fetchCityWeather("London")).thenReturn(new AggregatedWeather(
                51.52, -0.11, 1_714_564_800L, 13.0, List.of(WeatherCondition.CLOUDY, WeatherCondition.LIGHT_RAIN)));

        mvc.perform(get("/api/v1/weather").param("city", "London"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith("application/json"))
                .andExpect(header().exists("X-Request-ID"))
                .andExpect(jsonPath("$.requestId").isNotEmpty())
                .andExpect(jsonPath("$.city").value("London"))
                .andExpect(jsonPath("$.weather.latitude").value(51.52))
                .andExpect(jsonPath("$.weather.last_update").value("2024-05-01T12:00:00+00:00"))
                .andExpect(jsonPath("$.weather.temp_c").value("13.00"))
                .andExpect(jsonPath("$.weather.weather_condition").value("Cloudy or Light Rain"))
                .andExpect(jsonPath("$.last_access").value("2024-05-01T12:00:00+00:00"))
                .andExpect(jsonPath("$.recent_cities[0]").value("Paris"))
                .andExpect(jsonPath("$.recent_cities[1]").value("Oslo"));
    }

    @Test
    void firstVisit_lastAccessIsNotAvailable() throws Exception {
        when(accessLog.previousAccess(IP)).thenReturn(Optional.empty());
        when(weatherService.fetchCityWeather("London")).thenReturn(new AggregatedWeather(
                51.52, -0.11, 1_714_564_800L, null, List.of()));

        mvc.perform(get("/api/v1/weather").param("city", "London"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.last_access").value("N / A"))
                .andExpect(jsonPath("$.weather.temp_c").value("N / A"))
                .andExpect(jsonPath("$.weather.weather_condition").value("N / A"));
    }

    @Test
    void missingCity_returns400_withoutTouchingHistory() throws Exception {
        mvc.perform(get("/api/v1/weather"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Bad Request"))
                .andExpect(jsonPath("$.details").value("Please include ?city=CityName in the request URL."))
                .andExpect(jsonPath("$.last_access").doesNotExist());

        mvc.perform(get("/api/v1/weather").param("city", "  "))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(weatherService);
        verify(accessLog, never()).recordAccess(anyString(), anyLong(), anyString());
    }

    @Test
    void unknownCity_returns404_withHistory() throws Exception {
        when(weatherService.fetchCityWeather("Atlantis"))
                .thenThrow(new CityWeatherNotFoundException("Atlantis", null));

        mvc.perform(get("/api/v1/weather").param("city", "Atlantis"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not found"))
                .andExpect(jsonPath("$.details").value("No matching city was found with the name 'Atlantis'."))
                .andExpect(jsonPath("$.recent_cities[0]").value("Paris"));

        verify(accessLog).recordAccess(eq(IP), anyLong(), eq("Atlantis"));
    }

    @Test
    void noUsableData_returns503() throws Exception {
        when(weatherService.fetchCityWeather("Oslo"))
                .thenThrow(new CityWeatherFetchException("All city weather data were filtered out"));

        mvc.perform(get("/api/v1/weather").param("city", "Oslo"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("Service Unavailable"))
                .andExpect(jsonPath("$.last_access").value("2024-05-01T12:00:00+00:00"));
    }

    @Test
    void providerFailure_returns503() throws Exception {
        when(weatherService.fetchCityWeather("London"))
                .thenThrow(new CityWeatherRequestException("London", new RuntimeException("timeout")));

        mvc.perform(get("/api/v1/weather").param("city", "London"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void historyFailure_returns500() throws Exception {
        when(accessLog.previousAccess(IP))
                .thenThrow(new AccessLogException("Error retrieving last access of " + IP, new RuntimeException()));

        mvc.perform(get("/api/v1/weather").param("city", "London"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("Internal Server Error"))
                .andExpect(jsonPath("$.requestId").isNotEmpty());

        verifyNoInteractions(weatherService);
    }

    @Test
    void unexpectedFailure_returns500() throws Exception {
        when(weatherService.fetchCityWeather("London"))
                .thenThrow(new UnsupportedObservationKindException("no normalizer"));

        mvc.perform(get("/api/v1/weather").param("city", "London"))
                .andExpect(status().isInternalServerError());
    }

    @Test
    void missingClientAddress_returns500() throws Exception {
        mvc.perform(get("/api/v1/weather").param("city", "London").with(request -> {
                    request.setRemoteAddr("");
                    return request;
                }))
                .andExpect(status().isInternalServerError());

        verifyNoInteractions(weatherService);
    }
}
