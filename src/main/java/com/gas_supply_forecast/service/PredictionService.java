package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.forecast.ForecastRow;
import com.gas_supply_forecast.dto.forecast.PredictionResultDTO;
import com.gas_supply_forecast.dto.forecast.PredictionRow;
import com.gas_supply_forecast.dto.forecast.PredictionTable;
import com.gas_supply_forecast.dto.request.PredictionRequest;
import com.gas_supply_forecast.dto.train.FittedModel;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.TrainingOutcome;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;
import com.gas_supply_forecast.exception.MissingForecastInputException;
import com.gas_supply_forecast.util.TrainingHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class PredictionService {

    private final ModelCacheService modelCacheService;
    private final TrainingHelper trainingHelper;

    /**
     * Validates the forecast, makes sure models for the request's selection are trained and
     * predicts every row with every selected algorithm.
     */
    public PredictionResultDTO predict(PredictionTaskEnum task, PredictionRequest request) {
        validateInput(task, request.getRows());

        TrainingSelection selection = trainingHelper.toSelection(request.getSelection(), task);
        boolean retrain = request.getSelection() != null && request.getSelection().isRetrain();
        TrainingOutcome outcome = modelCacheService.ensureTrained(task, selection, retrain);

        PredictionTable table = predict(task, request.getRows(), outcome.modelSet(), selection.algorithms());

        Map<String, PredictionTable> unitTables = new LinkedHashMap<>();
        for (TargetUnitEnum unit : task.getTargetUnits()) {
            unitTables.put(unit.name(), table.unitView(unit));
        }

        return PredictionResultDTO.builder()
                .training(trainingHelper.toSummary(outcome))
                .table(table)
                .unitTables(unitTables)
                .build();
    }

    /**
     * Predicts every forecast row with the selected algorithms of a cached model set. Supply
     * values are truncated to whole units; temperatures are rounded to one decimal.
     *
     * @throws MissingForecastInputException if any row lacks a feature value; no model is called
     * @throws com.gas_supply_forecast.exception.ModelNotAvailableException if an algorithm has no fitted model
     */
    public PredictionTable predict(PredictionTaskEnum task, List<ForecastRow> rows, ModelSet modelSet,
                                   Collection<String> algorithms) {
        validateInput(task, rows);

        List<FittedModel> models = new ArrayList<>();
        for (String name : orderedAlgorithms(algorithms)) {
            for (TargetUnitEnum unit : task.getTargetUnits()) {
                models.add(modelSet.get(name, unit));
            }
        }
        // unit-major column order, e.g. all _M3 columns before the _MJ ones
        models.sort(Comparator.comparing((FittedModel m) -> m.unit().ordinal())
                .thenComparing(m -> m.algorithm().ordinal()));

        List<String> featureColumns = task.getFeatureColumns();
        List<String> columns = models.stream().map(m -> m.unit().predictionColumn(m.algorithm())).toList();

        List<PredictionRow> predicted = new ArrayList<>(rows.size());
        for (ForecastRow row : rows) {
            double[] features = new double[featureColumns.size()];
            Map<String, Double> featureValues = new LinkedHashMap<>();
            for (int i = 0; i < featureColumns.size(); i++) {
                features[i] = row.value(featureColumns.get(i));
                featureValues.put(featureColumns.get(i), features[i]);
            }

            Map<String, Number> values = new LinkedHashMap<>();
            for (FittedModel model : models) {
                values.put(model.unit().predictionColumn(model.algorithm()), format(task, model.predict(features)));
            }
            predicted.add(new PredictionRow(row.date(), featureValues, values));
        }

        log.info("🔮 Predicted {} {} rows with {}", predicted.size(), task, columns);
        return new PredictionTable(task, featureColumns, columns, predicted);
    }

    /**
     * @throws MissingForecastInputException listing every date whose feature values are incomplete
     *                                       and the position of every row without a date
     */
    public void validateInput(PredictionTaskEnum task, List<ForecastRow> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new MissingForecastInputException(List.of());
        }
        List<LocalDate> incomplete = new ArrayList<>();
        List<Integer> undated = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            ForecastRow row = rows.get(i);
            if (row.date() == null) {
                undated.add(i + 1);
                continue;
            }
            for (String column : task.getFeatureColumns()) {
                Double value = row.value(column);
                if (value == null || value.isNaN() || value.isInfinite()) {
                    incomplete.add(row.date());
                    break;
                }
            }
        }
        if (!incomplete.isEmpty() || !undated.isEmpty()) {
            throw new MissingForecastInputException(incomplete, undated);
        }
    }

    // known algorithms in catalog order, unknown names after them
    private List<String> orderedAlgorithms(Collection<String> algorithms) {
        return algorithms.stream()
                .sorted(Comparator.comparing((String name) -> AlgorithmEnum.fromName(name)
                                .map(Enum::ordinal)
                                .orElse(Integer.MAX_VALUE))
                        .thenComparing(Comparator.naturalOrder()))
                .toList();
    }

    private Number format(PredictionTaskEnum task, double value) {
        if (task == PredictionTaskEnum.SUPPLY) {
            return (long) value;
        }
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_UP);
    }
}
