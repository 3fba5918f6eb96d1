package com.gas_supply_forecast.dto.forecast;

import com.gas_supply_forecast.util.DatasetColumns;

import java.time.LocalDate;

/**
 * One operator forecast for a future day. Supply forecasts use {@code avgTemp}; temperature
 * forecasts use {@code maxTemp} and {@code minTemp}. Unfilled cells are null.
 */
public record ForecastRow(LocalDate date, Double avgTemp, Double maxTemp, Double minTemp) {

    public static ForecastRow empty(LocalDate date) {
        return new ForecastRow(date, null, null, null);
    }

    public Double value(String column) {
        return switch (column) {
            case DatasetColumns.AVG_TEMP -> avgTemp;
            case DatasetColumns.MAX_TEMP -> maxTemp;
            case DatasetColumns.MIN_TEMP -> minTemp;
            default -> throw new IllegalArgumentException("Not a forecast feature: " + column);
        };
    }
}
