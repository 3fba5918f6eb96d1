package com.gas_supply_forecast.enumeration;

public enum CacheMissReasonEnum {
    EMPTY,
    SELECTION_CHANGED,
    RETRAIN_REQUESTED
}
