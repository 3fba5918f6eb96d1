package com.gas_supply_forecast.exception;

/**
 * A training set is too small to fit on. Raised before any regressor is built.
 */
public class InsufficientDataException extends RuntimeException {

    public InsufficientDataException(String message) {
        super(message);
    }

    public InsufficientDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
