package com.skyfuse.weather.repository;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;

class WeatherCodebookTest {

    private static WeatherCodebook load(String location) {
        WeatherCodebook codebook = new WeatherCodebook(new DefaultResourceLoader(), location);
        codebook.init();
        return codebook;
    }

    @Test
    void bundledTable_resolvesWmoCodes() {
        WeatherCodebook codebook = load("classpath:open_meteo_weather_codes.csv");

        assertThat(codebook.describe(0)).contains("Clear sky");
        assertThat(codebook.describe(63)).contains("Moderate rain");
        assertThat(codebook.describe(82)).contains("Violent rain showers");
        assertThat(codebook.describe(4)).isEmpty();
    }

    @Test
    void missingTable_isEmpty() {
        WeatherCodebook codebook = load("classpath:codebooks/does-not-exist.csv");

        assertThat(codebook.size()).isZero();
        assertThat(codebook.describe(0)).isEmpty();
    }

    @Test
    void badRows_areSkipped_andQuotedValuesKept() {
        WeatherCodebook codebook = load("classpath:codebooks/with-bad-rows.csv");

        assertThat(codebook.size()).isEqualTo(2);
        assertThat(codebook.describe(0)).contains("Clear sky");
        assertThat(codebook.describe(61)).contains("Slight rain, at times");
        assertThat(codebook.describe(62)).isEmpty();
    }

    @Test
    void unexpectedHeader_isEmpty() {
        assertThat(load("classpath:codebooks/wrong-header.csv").size()).isZero();
    }
}
