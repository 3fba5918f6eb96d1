package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.dto.train.FittedModel;
import com.gas_supply_forecast.dto.train.ModelKey;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.RegressionEvaluationResult;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;
import com.gas_supply_forecast.exception.InsufficientDataException;
import com.gas_supply_forecast.exception.ModelTrainingException;
import com.gas_supply_forecast.strategy.RegressorRegistry;
import com.gas_supply_forecast.util.DatasetUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import weka.classifiers.Classifier;
import weka.classifiers.evaluation.Evaluation;
import weka.core.Instances;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fits one regressor per (selected algorithm, target unit) of a task. Returns the models and
 * keeps no state of its own.
 */
@Service
@Slf4j
public class ModelTrainingService {

    private final RegressorRegistry regressorRegistry;
    private final int minRows;

    public ModelTrainingService(RegressorRegistry regressorRegistry,
                                @Value("${forecast.training.min-rows:2}") int minRows) {
        this.regressorRegistry = regressorRegistry;
        this.minRows = minRows;
    }

    /**
     * Algorithms of the selection that the task offers, in catalog order. Names that match no
     * algorithm, or an algorithm the task does not offer, are left out.
     */
    public List<AlgorithmEnum> resolveAlgorithms(PredictionTaskEnum task, TrainingSelection selection) {
        List<AlgorithmEnum> resolved = new ArrayList<>();
        for (AlgorithmEnum algorithm : task.getAlgorithms()) {
            boolean requested = selection.algorithms().stream()
                    .map(AlgorithmEnum::fromName)
                    .flatMap(Optional::stream)
                    .anyMatch(a -> a == algorithm);
            if (requested) {
                resolved.add(algorithm);
            }
        }
        return resolved;
    }

    /**
     * @throws InsufficientDataException if the training set has fewer usable rows than required;
     *                                   nothing is fitted in that case
     */
    public ModelSet train(PredictionTaskEnum task, TrainingSelection selection, List<EnrichedRecord> trainingSet) {
        if (trainingSet.size() < minRows) {
            throw new InsufficientDataException(String.format(
                    "%s training needs at least %d complete rows but the selection yields %d",
                    task, minRows, trainingSet.size()));
        }

        List<AlgorithmEnum> algorithms = resolveAlgorithms(task, selection);
        if (algorithms.size() < selection.algorithms().size()) {
            log.warn("⚠️ Requested algorithms {} include names not offered for {}; fitting {}",
                    selection.algorithms(), task, algorithms);
        }

        log.info("🚀 Training {} models {} on {} rows", task, algorithms, trainingSet.size());
        long start = System.currentTimeMillis();

        Map<ModelKey, FittedModel> models = new LinkedHashMap<>();
        for (TargetUnitEnum unit : task.getTargetUnits()) {
            Instances data = DatasetUtil.toInstances(trainingSet, task, unit);
            for (AlgorithmEnum algorithm : algorithms) {
                FittedModel model = fit(algorithm, unit, data);
                models.put(model.key(), model);
            }
        }

        log.info("✅ Trained {} {} models in {} ms", models.size(), task, System.currentTimeMillis() - start);
        return new ModelSet(task, selection, trainingSet.size(), models);
    }

    public FittedModel fit(AlgorithmEnum algorithm, TargetUnitEnum unit, Instances data) {
        Classifier classifier = regressorRegistry.create(algorithm);
        try {
            classifier.buildClassifier(data);
            RegressionEvaluationResult evaluation = evaluateRegressor(classifier, data);
            log.info("📈 {}: RMSE={} MAE={} R²={}", unit.predictionColumn(algorithm),
                    evaluation.getRmse(), evaluation.getMae(), evaluation.getRSquared());
            return new FittedModel(algorithm, unit, classifier, new Instances(data, 0), evaluation);
        } catch (Exception e) {
            log.error("❌ Training {} failed: {}", unit.predictionColumn(algorithm), e.getMessage(), e);
            throw new ModelTrainingException("Training " + unit.predictionColumn(algorithm) + " failed", e);
        }
    }

    /**
     * In-sample RMSE, MAE and R² (squared correlation). Undefined values are reported as null.
     */
    public RegressionEvaluationResult evaluateRegressor(Classifier regressor, Instances data) throws Exception {
        Evaluation eval = new Evaluation(data);
        eval.evaluateModel(regressor, data);

        double correlation = eval.correlationCoefficient();
        return new RegressionEvaluationResult(
                finite(eval.rootMeanSquaredError()),
                finite(eval.meanAbsoluteError()),
                finite(correlation * correlation),
                data.numInstances());
    }

    private Double finite(double value) {
        return Double.isNaN(value) || Double.isInfinite(value) ? null : value;
    }
}
