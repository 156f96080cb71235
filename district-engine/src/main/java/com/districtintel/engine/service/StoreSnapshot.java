package com.districtintel.engine.service;

import com.districtintel.engine.model.DistrictStore;
import com.districtintel.engine.model.QualityMetrics;

/**
 * A store and the quality metrics of the cycle that produced it, published together.
 */
public record StoreSnapshot(DistrictStore store, QualityMetrics metrics) {

    private static final StoreSnapshot EMPTY = new StoreSnapshot(DistrictStore.empty(), QualityMetrics.empty());

    public static StoreSnapshot empty() {
        return EMPTY;
    }
}
