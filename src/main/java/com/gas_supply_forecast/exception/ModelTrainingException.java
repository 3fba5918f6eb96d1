package com.gas_supply_forecast.exception;


public class ModelTrainingException extends RuntimeException {

    public ModelTrainingException(String message) {
        super(message);
    }

    public ModelTrainingException(String message, Throwable cause) {
        super(message, cause);
    }
}
