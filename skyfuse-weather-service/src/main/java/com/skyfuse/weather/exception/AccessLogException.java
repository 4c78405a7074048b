package com.skyfuse.weather.exception;

public class AccessLogException extends RuntimeException {

    public AccessLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
