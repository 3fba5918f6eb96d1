package com.gas_supply_forecast.exception;


public class UnsupportedAlgorithmException extends RuntimeException {

    public UnsupportedAlgorithmException(String message) {
        super(message);
    }

    public UnsupportedAlgorithmException(String message, Throwable cause) {
        super(message, cause);
    }
}
