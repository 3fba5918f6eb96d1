package com.gas_supply_forecast.exception;

/**
 * The dataset file breaks its input contract: missing date column, unparseable date or number.
 */
public class DatasetFormatException extends RuntimeException {

    public DatasetFormatException(String message) {
        super(message);
    }

    public DatasetFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
