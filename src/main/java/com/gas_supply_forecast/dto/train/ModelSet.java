package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;
import com.gas_supply_forecast.exception.ModelNotAvailableException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable result of one training run: every fitted model of a task, keyed by
 * (algorithm, unit), plus the selection that produced it.
 */
public record ModelSet(
        PredictionTaskEnum task,
        TrainingSelection selection,
        int trainingRows,
        Map<ModelKey, FittedModel> models
) {

    public ModelSet {
        models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
    }

    /**
     * Looks up the model for an algorithm name as the operator typed it.
     *
     * @throws ModelNotAvailableException if the name is unknown or was never fitted for the unit
     */
    public FittedModel get(String algorithmName, TargetUnitEnum unit) {
        AlgorithmEnum algorithm = AlgorithmEnum.fromName(algorithmName)
                .orElseThrow(() -> new ModelNotAvailableException(algorithmName, unit.name()));
        return get(algorithm, unit);
    }

    public FittedModel get(AlgorithmEnum algorithm, TargetUnitEnum unit) {
        FittedModel model = models.get(new ModelKey(algorithm, unit));
        if (model == null) {
            throw new ModelNotAvailableException(algorithm.name(), unit.name());
        }
        return model;
    }

    public Collection<FittedModel> all() {
        return models.values();
    }

    /**
     * Requested names that produced no model, either unknown or not offered for the task.
     */
    public Set<String> unfittedAlgorithms() {
        Set<String> unfitted = new TreeSet<>();
        for (String name : selection.algorithms()) {
            boolean fitted = AlgorithmEnum.fromName(name)
                    .map(a -> models.keySet().stream().anyMatch(k -> k.algorithm() == a))
                    .orElse(false);
            if (!fitted) {
                unfitted.add(name);
            }
        }
        return unfitted;
    }
}
