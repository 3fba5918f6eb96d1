package com.gas_supply_forecast.unit_tests.service;

import com.gas_supply_forecast.dto.record.DailyRecord;
import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.TrainingOutcome;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.CacheMissReasonEnum;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import com.gas_supply_forecast.enumeration.WeekdayEnum;
import com.gas_supply_forecast.exception.InsufficientDataException;
import com.gas_supply_forecast.service.DatasetService;
import com.gas_supply_forecast.service.FeatureEnrichmentService;
import com.gas_supply_forecast.service.ModelCacheService;
import com.gas_supply_forecast.service.ModelTrainingService;
import com.gas_supply_forecast.service.TrainingSetSelector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ModelCacheServiceTest {

    @Mock
    private DatasetService datasetService;
    @Mock
    private FeatureEnrichmentService featureEnrichmentService;
    @Mock
    private TrainingSetSelector trainingSetSelector;
    @Mock
    private ModelTrainingService modelTrainingService;

    @InjectMocks
    private ModelCacheService modelCacheService;

    private final TrainingSelection selection = new TrainingSelection(
            Set.of(2023, 2024), Set.of(1, 2), Set.of(WeekdayEnum.MONDAY, WeekdayEnum.TUESDAY), Set.of("KNN", "POLYNOMIAL"));

    @BeforeEach
    void setUp() {
        List<DailyRecord> records = List.of();
        List<EnrichedRecord> enriched = List.of();
        when(datasetService.getRecords()).thenReturn(records);
        when(featureEnrichmentService.enrich(records)).thenReturn(enriched);
        when(trainingSetSelector.select(anyList(), any(), any())).thenReturn(enriched);
        when(modelTrainingService.train(eq(PredictionTaskEnum.SUPPLY), any(), anyList()))
                .thenAnswer(inv -> new ModelSet(PredictionTaskEnum.SUPPLY, inv.getArgument(1), 10, Map.of()));
    }

    @Test
    @DisplayName("first request trains, identical selection is served from the cache")
    void trainsOnceForSameSelection() {
        TrainingOutcome first = modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, false);
        TrainingSelection reordered = new TrainingSelection(
                Set.of(2024, 2023), Set.of(2, 1), Set.of(WeekdayEnum.TUESDAY, WeekdayEnum.MONDAY), Set.of("polynomial", "knn"));
        TrainingOutcome second = modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, reordered, false);

        assertThat(first.cacheHit()).isFalse();
        assertThat(first.missReason()).isEqualTo(CacheMissReasonEnum.EMPTY);
        assertThat(second.cacheHit()).isTrue();
        assertThat(second.modelSet()).isSameAs(first.modelSet());
        verify(modelTrainingService, times(1)).train(any(), any(), anyList());
    }

    @Test
    void changedSelectionRetrains() {
        modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, false);

        TrainingOutcome outcome = modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY,
                selection.withAlgorithms(List.of("KNN")), false);

        assertThat(outcome.cacheHit()).isFalse();
        assertThat(outcome.missReason()).isEqualTo(CacheMissReasonEnum.SELECTION_CHANGED);
        verify(modelTrainingService, times(2)).train(any(), any(), anyList());
    }

    @Test
    void explicitRetrainBypassesTheCache() {
        modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, false);

        TrainingOutcome outcome = modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, true);

        assertThat(outcome.missReason()).isEqualTo(CacheMissReasonEnum.RETRAIN_REQUESTED);
        verify(modelTrainingService, times(2)).train(any(), any(), anyList());
    }

    @Test
    @DisplayName("a failed training leaves the previous models in place")
    void failedTrainingKeepsPreviousSnapshot() {
        ModelSet previous = modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, false).modelSet();
        doThrow(new InsufficientDataException("too few rows"))
                .when(modelTrainingService).train(eq(PredictionTaskEnum.SUPPLY), any(), anyList());

        assertThatThrownBy(() -> modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, true))
                .isInstanceOf(InsufficientDataException.class);
        assertThat(modelCacheService.current(PredictionTaskEnum.SUPPLY)).containsSame(previous);
    }

    @Test
    void tasksHaveSeparateCachesAndCanBeInvalidated() {
        modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, false);

        assertThat(modelCacheService.current(PredictionTaskEnum.TEMPERATURE)).isEmpty();

        modelCacheService.invalidate(PredictionTaskEnum.SUPPLY);
        assertThat(modelCacheService.current(PredictionTaskEnum.SUPPLY)).isEmpty();
        assertThat(modelCacheService.ensureTrained(PredictionTaskEnum.SUPPLY, selection, false).missReason())
                .isEqualTo(CacheMissReasonEnum.EMPTY);
    }
}
