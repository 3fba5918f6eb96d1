package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.exception.WeatherApiException;

import java.time.LocalDate;

/**
 * Source of observed daily temperatures.
 */
public interface WeatherObservationClient {

    /**
     * @return the observation of {@code date} with supply values left empty
     * @throws WeatherApiException if the upstream service fails or has no observation for the date
     */
    DailyRecord fetchDaily(LocalDate date);
}
