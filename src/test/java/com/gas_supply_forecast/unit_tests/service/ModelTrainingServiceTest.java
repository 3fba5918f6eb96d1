package com.gas_supply_forecast.unit_tests.service;

import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.dto.train.FittedModel;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.AlgorithmEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.TargetUnitEnum;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import com.gas_supply_forecast.exception.InsufficientDataException;
import com.gas_supply_forecast.exception.ModelNotAvailableException;
import com.gas_supply_forecast.service.ModelTrainingService;
import com.gas_supply_forecast.strategy.RegressorRegistry;
import com.gas_supply_forecast.unit_tests.TestRecords;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ModelTrainingServiceTest {

    private static List<EnrichedRecord> trainingSet;
    private final ModelTrainingService service = new ModelTrainingService(new RegressorRegistry(), 2);

    @BeforeAll
    static void loadData() {
        trainingSet = TestRecords.enrichedYear(2023);
    }

    private static TrainingSelection selection(String... algorithms) {
        return new TrainingSelection(Set.of(2023), Set.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12),
                EnumSet.allOf(WeekdayEnum.class), Set.of(algorithms));
    }

    @Test
    @DisplayName("each supply algorithm is fitted once per unit")
    void fitsEverySupplyAlgorithmForBothUnits() {
        TrainingSelection selection = selection("POLYNOMIAL", "RANDOM_FOREST", "KNN", "DECISION_TREE", "GRADIENT_BOOSTING");

        ModelSet models = service.train(PredictionTaskEnum.SUPPLY, selection, trainingSet);

        assertThat(models.models()).hasSize(10);
        assertThat(models.trainingRows()).isEqualTo(365);
        for (AlgorithmEnum algorithm : PredictionTaskEnum.SUPPLY.getAlgorithms()) {
            assertThat(models.get(algorithm, TargetUnitEnum.M3).unit()).isEqualTo(TargetUnitEnum.M3);
            assertThat(models.get(algorithm, TargetUnitEnum.MJ).unit()).isEqualTo(TargetUnitEnum.MJ);
        }
    }

    @Test
    void temperatureLinearModelLearnsTheMidpoint() {
        ModelSet models = service.train(PredictionTaskEnum.TEMPERATURE, selection("LINEAR", "RANDOM_FOREST"), trainingSet);

        FittedModel linear = models.get(AlgorithmEnum.LINEAR, TargetUnitEnum.AVG_TEMP);
        assertThat(linear.predict(12.0, 2.0)).isCloseTo(7.0, within(0.01));
        assertThat(linear.evaluation().getRSquared()).isCloseTo(1.0, within(1e-6));
        assertThat(linear.evaluation().getRmse()).isCloseTo(0.0, within(1e-3));
    }

    @Test
    void refittingGivesIdenticalPredictions() {
        TrainingSelection selection = selection("RANDOM_FOREST", "GRADIENT_BOOSTING");

        ModelSet first = service.train(PredictionTaskEnum.SUPPLY, selection, trainingSet);
        ModelSet second = service.train(PredictionTaskEnum.SUPPLY, selection, trainingSet);

        for (FittedModel model : first.all()) {
            FittedModel other = second.get(model.algorithm(), model.unit());
            assertThat(other.predict(3.3)).isEqualTo(model.predict(3.3));
        }
    }

    @Test
    void fewerThanTwoRowsIsInsufficient() {
        assertThatThrownBy(() -> service.train(PredictionTaskEnum.SUPPLY, selection("KNN"), trainingSet.subList(0, 1)))
                .isInstanceOf(InsufficientDataException.class)
                .hasMessageContaining("1");
        assertThatThrownBy(() -> service.train(PredictionTaskEnum.TEMPERATURE, selection("LINEAR"), List.of()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void unknownAndForeignAlgorithmsAreNotFitted() {
        ModelSet models = service.train(PredictionTaskEnum.TEMPERATURE, selection("LINEAR", "KNN", "LINAER"), trainingSet);

        assertThat(models.models()).hasSize(1);
        assertThat(models.unfittedAlgorithms()).containsExactly("KNN", "LINAER");
        assertThatThrownBy(() -> models.get("LINAER", TargetUnitEnum.AVG_TEMP))
                .isInstanceOf(ModelNotAvailableException.class)
                .hasMessageContaining("LINAER");
    }
}
