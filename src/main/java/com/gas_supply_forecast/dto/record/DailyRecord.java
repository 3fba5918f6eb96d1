package com.gas_supply_forecast.dto.record;

import com.gas_supply_forecast.util.DatasetColumns;

import java.time.LocalDate;

/**
 * One calendar day of observed weather and supply. Any measurement may be absent (null).
 */
public record DailyRecord(
        LocalDate date,
        Double avgTemp,
        Double minTemp,
        Double maxTemp,
        Double supplyM3,
        Double supplyMj
) {

    public static DailyRecord temperatures(LocalDate date, Double avgTemp, Double minTemp, Double maxTemp) {
        return new DailyRecord(date, avgTemp, minTemp, maxTemp, null, null);
    }

    public Double value(String column) {
        return switch (column) {
            case DatasetColumns.AVG_TEMP -> avgTemp;
            case DatasetColumns.MIN_TEMP -> minTemp;
            case DatasetColumns.MAX_TEMP -> maxTemp;
            case DatasetColumns.SUPPLY_M3 -> supplyM3;
            case DatasetColumns.SUPPLY_MJ -> supplyMj;
            default -> throw new IllegalArgumentException("Unknown numeric column: " + column);
        };
    }
}
