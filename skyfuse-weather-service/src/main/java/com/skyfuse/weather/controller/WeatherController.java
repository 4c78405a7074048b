package com.skyfuse.weather.controller;

import com.skyfuse.weather.config.RequestIdFilter;
import com.skyfuse.weather.dto.WeatherDtos.ErrorResponse;
import com.skyfuse.weather.dto.WeatherDtos.WeatherResponse;
import com.skyfuse.weather.dto.WeatherDtos.WeatherView;
import com.skyfuse.weather.exception.CityWeatherFetchException;
import com.skyfuse.weather.exception.CityWeatherNotFoundException;
import com.skyfuse.weather.exception.GlobalExceptionHandler;
import com.skyfuse.weather.model.AggregatedWeather;
import com.skyfuse.weather.service.AccessLogService;
import com.skyfuse.weather.service.AccessLogService.AccessRecord;
import com.skyfuse.weather.service.WeatherService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

import static com.skyfuse.weather.dto.WeatherDtos.isoUtcOrNotAvailable;

@RestController
@RequestMapping("/api/v1")
public class WeatherController {

    private static final Logger log = LoggerFactory.getLogger(WeatherController.class);

    private final WeatherService weatherService;
    private final AccessLogService accessLog;
    private final Clock clock;

    public WeatherController(WeatherService weatherService, AccessLogService accessLog, Clock clock) {
        this.weatherService = weatherService;
        this.accessLog = accessLog;
        this.clock = clock;
    }

    @GetMapping("/weather")
    public ResponseEntity<?> get(@RequestParam(required = false) String city, HttpServletRequest request) {
        String requestId = RequestIdFilter.requestId(request);

        if (city == null || city.isBlank()) {
            log.info("Request missing 'city' parameter");
            return ResponseEntity.badRequest().body(new ErrorResponse(
                    requestId,
                    "Bad Request",
                    "The required query parameter 'city' is missing.",
                    "Please include ?city=CityName in the request URL."
            ));
        }

        String ip = request.getRemoteAddr();
        if (ip == null || ip.isBlank()) {
            log.warn("Could not determine client IP");
            return GlobalExceptionHandler.internalServerError(request);
        }
        log.info("Received weather request for '{}' from {}", city, ip);

        String lastAccess = isoUtcOrNotAvailable(accessLog.previousAccess(ip).orElse(null));
        AccessRecord access = accessLog.recordAccess(ip, clock.instant().getEpochSecond(), city);
        log.info("Previous access: {}", lastAccess);

        try {
            AggregatedWeather weather = weatherService.fetchCityWeather(city);
            return ResponseEntity.ok(new WeatherResponse(
                    requestId,
                    city,
                    WeatherView.from(weather),
                    lastAccess,
                    access.previousCities()
            ));
        } catch (CityWeatherNotFoundException e) {
            log.info("City not found: {}", city);
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorResponse(
                    requestId,
                    "Not found",
                    "No data available for the specified city.",
                    "No matching city was found with the name '" + city + "'.",
                    lastAccess,
                    access.previousCities()
            ));
        } catch (CityWeatherFetchException e) {
            log.warn("Weather fetch failed for {}: {}", city, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(new ErrorResponse(
                    requestId,
                    "Service Unavailable",
                    "Service is currently unavailable.",
                    "Please try again later.",
                    lastAccess,
                    access.previousCities()
            ));
        }
    }
}
