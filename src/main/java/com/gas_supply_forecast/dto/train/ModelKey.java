package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;

public record ModelKey(AlgorithmEnum algorithm, TargetUnitEnum unit) {

    @Override
    public String toString() {
        return unit.predictionColumn(algorithm);
    }
}
