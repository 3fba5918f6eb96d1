package com.gas_supply_forecast.dto.forecast;

import java.time.LocalDate;
import java.util.Map;

/**
 * @param features    forecast feature values by column name
 * @param predictions predicted value by prediction column (e.g. {@code KNN_M3})
 */
public record PredictionRow(LocalDate date, Map<String, Double> features, Map<String, Number> predictions) {
}
