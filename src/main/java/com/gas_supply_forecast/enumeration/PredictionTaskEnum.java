package com.gas_supply_forecast.enumeration;

import com.gas_supply_forecast.util.DatasetColumns;

import java.util.ArrayList;
import java.util.List;

/**
 * The two prediction tasks the service supports, with their feature columns,
 * target units and the algorithms offered for each.
 */
public enum PredictionTaskEnum {

    TEMPERATURE(
            List.of(DatasetColumns.MAX_TEMP, DatasetColumns.MIN_TEMP),
            List.of(TargetUnitEnum.AVG_TEMP),
            List.of(AlgorithmEnum.LINEAR, AlgorithmEnum.RANDOM_FOREST)),

    SUPPLY(
            List.of(DatasetColumns.AVG_TEMP),
            List.of(TargetUnitEnum.M3, TargetUnitEnum.MJ),
            List.of(AlgorithmEnum.POLYNOMIAL, AlgorithmEnum.RANDOM_FOREST, AlgorithmEnum.KNN,
                    AlgorithmEnum.DECISION_TREE, AlgorithmEnum.GRADIENT_BOOSTING));

    private final List<String> featureColumns;
    private final List<TargetUnitEnum> targetUnits;
    private final List<AlgorithmEnum> algorithms;

    PredictionTaskEnum(List<String> featureColumns, List<TargetUnitEnum> targetUnits, List<AlgorithmEnum> algorithms) {
        this.featureColumns = featureColumns;
        this.targetUnits = targetUnits;
        this.algorithms = algorithms;
    }

    public List<String> getFeatureColumns() {
        return featureColumns;
    }

    public List<TargetUnitEnum> getTargetUnits() {
        return targetUnits;
    }

    public List<AlgorithmEnum> getAlgorithms() {
        return algorithms;
    }

    public boolean supports(AlgorithmEnum algorithm) {
        return algorithms.contains(algorithm);
    }

    /**
     * Every column a row must carry to take part in this task's fit.
     */
    public List<String> getRequiredColumns() {
        List<String> columns = new ArrayList<>(featureColumns);
        for (TargetUnitEnum unit : targetUnits) {
            if (!columns.contains(unit.getColumn())) {
                columns.add(unit.getColumn());
            }
        }
        return columns;
    }
}
