package com.gas_supply_forecast.enumeration;

public enum IngestionStatusEnum {
    APPENDED,
    ALREADY_PRESENT,
    SKIPPED_UPSTREAM_FAILURE
}
