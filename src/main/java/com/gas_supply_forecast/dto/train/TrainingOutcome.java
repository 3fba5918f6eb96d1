package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.CacheMissReasonEnum;

public record TrainingOutcome(ModelSet modelSet, boolean cacheHit, CacheMissReasonEnum missReason) {
}
