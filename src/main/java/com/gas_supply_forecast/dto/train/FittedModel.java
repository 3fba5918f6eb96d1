package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;
import com.gas_supply_forecast.exception.ModelTrainingException;
import com.gas_supply_forecast.util.DatasetUtil;
import weka.classifiers.Classifier;
import weka.core.Instances;

/**
 * A trained regressor for one (algorithm, target unit) pair. The header is the empty
 * training schema used to shape prediction instances. Never mutated after training.
 */
public record FittedModel(
        AlgorithmEnum algorithm,
        TargetUnitEnum unit,
        Classifier classifier,
        Instances header,
        RegressionEvaluationResult evaluation
) {

    public ModelKey key() {
        return new ModelKey(algorithm, unit);
    }

    public double predict(double... features) {
        try {
            return classifier.classifyInstance(DatasetUtil.toPredictionInstance(header, features));
        } catch (Exception e) {
            throw new ModelTrainingException("Prediction failed for " + key(), e);
        }
    }
}
