package com.skyfuse.weather;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SkyfuseWeatherApplication {

    public static void main(String[] args) {
        SpringApplication.run(SkyfuseWeatherApplication.class, args);
    }
}
