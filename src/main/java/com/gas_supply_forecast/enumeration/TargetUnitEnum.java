package com.gas_supply_forecast.enumeration;

import com.gas_supply_forecast.util.DatasetColumns;

public enum TargetUnitEnum {
    M3(DatasetColumns.SUPPLY_M3),
    MJ(DatasetColumns.SUPPLY_MJ),
    AVG_TEMP(DatasetColumns.AVG_TEMP);

    private final String column;

    TargetUnitEnum(String column) {
        this.column = column;
    }

    public String getColumn() {
        return column;
    }

    /**
     * Prediction table column for an algorithm, e.g. {@code RANDOM_FOREST_M3}.
     */
    public String predictionColumn(AlgorithmEnum algorithm) {
        return algorithm.name() + "_" + name();
    }
}
