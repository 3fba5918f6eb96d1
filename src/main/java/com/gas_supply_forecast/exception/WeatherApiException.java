package com.gas_supply_forecast.exception;

/**
 * The public weather service could not deliver a usable observation.
 */
public class WeatherApiException extends RuntimeException {

    public WeatherApiException(String message) {
        super(message);
    }

    public WeatherApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
