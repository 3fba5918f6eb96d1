package com.gas_supply_forecast.exception;

import lombok.Getter;

@Getter
public class ModelNotAvailableException extends RuntimeException {

    private final String algorithm;
    private final String unit;

    public ModelNotAvailableException(String algorithm, String unit) {
        super("No fitted model available for algorithm '" + algorithm + "' and unit " + unit);
        this.algorithm = algorithm;
        this.unit = unit;
    }
}
