package com.gas_supply_forecast.dto.train;

import com.gas_supply_forecast.enumeration.CacheMissReasonEnum;

/**
 * Outcome of a model cache lookup: a hit carrying the cached set, or a miss with its reason.
 */
public record CacheLookupResult(ModelSet modelSet, CacheMissReasonEnum missReason) {

    public static CacheLookupResult hit(ModelSet modelSet) {
        return new CacheLookupResult(modelSet, null);
    }

    public static CacheLookupResult miss(CacheMissReasonEnum reason) {
        return new CacheLookupResult(null, reason);
    }

    public boolean isHit() {
        return modelSet != null;
    }
}
