package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.record.EnrichedRecord;
import com.gas_supply_forecast.dto.train.CacheLookupResult;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.TrainingOutcome;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.PredictionTaskEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides per request whether the cached models can be reused or a new training run is due,
 * and runs it. One cache per task; training runs are serialized.
 */
@Service
@Slf4j
public class ModelCacheService {

    private final DatasetService datasetService;
    private final FeatureEnrichmentService featureEnrichmentService;
    private final TrainingSetSelector trainingSetSelector;
    private final ModelTrainingService modelTrainingService;

    private final Map<PredictionTaskEnum, ModelCache> caches = new EnumMap<>(PredictionTaskEnum.class);
    private final ReentrantLock trainingLock = new ReentrantLock();

    public ModelCacheService(DatasetService datasetService,
                             FeatureEnrichmentService featureEnrichmentService,
                             TrainingSetSelector trainingSetSelector,
                             ModelTrainingService modelTrainingService) {
        this.datasetService = datasetService;
        this.featureEnrichmentService = featureEnrichmentService;
        this.trainingSetSelector = trainingSetSelector;
        this.modelTrainingService = modelTrainingService;
        for (PredictionTaskEnum task : PredictionTaskEnum.values()) {
            caches.put(task, new ModelCache());
        }
    }

    /**
     * Returns models for the selection, training them first on a cache miss. A failed training
     * run leaves the previously cached set in place.
     */
    public TrainingOutcome ensureTrained(PredictionTaskEnum task, TrainingSelection selection, boolean forceRetrain) {
        ModelCache cache = caches.get(task);
        CacheLookupResult lookup = cache.lookup(selection, forceRetrain);
        if (lookup.isHit()) {
            log.info("♻️ {} model cache hit for {}", task, selection);
            return new TrainingOutcome(lookup.modelSet(), true, null);
        }

        trainingLock.lock();
        try {
            // another request may have trained the same selection while we waited
            CacheLookupResult recheck = cache.lookup(selection, forceRetrain);
            if (recheck.isHit()) {
                return new TrainingOutcome(recheck.modelSet(), true, null);
            }

            log.info("🔁 {} model cache miss ({}); training for {}", task, lookup.missReason(), selection);
            List<EnrichedRecord> enriched = featureEnrichmentService.enrich(datasetService.getRecords());
            List<EnrichedRecord> trainingSet = trainingSetSelector.select(enriched, selection, task);
            ModelSet modelSet = modelTrainingService.train(task, selection, trainingSet);
            cache.publish(modelSet);
            return new TrainingOutcome(modelSet, false, lookup.missReason());
        } finally {
            trainingLock.unlock();
        }
    }

    public Optional<ModelSet> current(PredictionTaskEnum task) {
        return caches.get(task).current();
    }

    public void invalidate(PredictionTaskEnum task) {
        log.info("🗑️ Invalidating {} model cache", task);
        caches.get(task).invalidate();
    }
}
