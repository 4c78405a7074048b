package com.skyfuse.weather.exception;

import com.skyfuse.weather.config.RequestIdFilter;
import com.skyfuse.weather.dto.WeatherDtos.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(AccessLogException.class)
    public ResponseEntity<ErrorResponse> handleAccessLogException(AccessLogException e, HttpServletRequest request) {
        log.error("Access history unavailable: {}", e.getMessage(), e);
        return internalServerError(request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e, HttpServletRequest request) {
        log.error("Unhandled exception: ", e);
        return internalServerError(request);
    }

    public static ResponseEntity<ErrorResponse> internalServerError(HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorResponse(
                RequestIdFilter.requestId(request),
                "Internal Server Error",
                "An unexpected error occurred.",
                "Please try again later."
        ));
    }
}
