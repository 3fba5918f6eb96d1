package com.gas_supply_forecast.service;

import com.gas_supply_forecast.dto.train.CacheLookupResult;
import com.gas_supply_forecast.dto.train.ModelSet;
import com.gas_supply_forecast.dto.train.TrainingSelection;
import com.gas_supply_forecast.enumeration.CacheMissReasonEnum;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the model set of the latest successful training run, keyed by its training selection.
 * A new set replaces the old one in a single step; readers keep whichever set they obtained.
 */
public class ModelCache {

    private final AtomicReference<ModelSet> current = new AtomicReference<>();

    public CacheLookupResult lookup(TrainingSelection selection, boolean retrainRequested) {
        ModelSet cached = current.get();
        if (cached == null) {
            return CacheLookupResult.miss(CacheMissReasonEnum.EMPTY);
        }
        if (retrainRequested) {
            return CacheLookupResult.miss(CacheMissReasonEnum.RETRAIN_REQUESTED);
        }
        if (!cached.selection().equals(selection)) {
            return CacheLookupResult.miss(CacheMissReasonEnum.SELECTION_CHANGED);
        }
        return CacheLookupResult.hit(cached);
    }

    public void publish(ModelSet modelSet) {
        current.set(modelSet);
    }

    public Optional<ModelSet> current() {
        return Optional.ofNullable(current.get());
    }

    public void invalidate() {
        current.set(null);
    }
}
