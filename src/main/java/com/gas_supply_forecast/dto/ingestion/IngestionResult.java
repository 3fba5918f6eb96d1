package com.gas_supply_forecast.dto.ingestion;

import com.gas_supply_forecast.enumeration.IngestionStatusEnum;

import java.time.LocalDate;

public record IngestionResult(LocalDate date, IngestionStatusEnum status, String message) {
}
