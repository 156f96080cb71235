package com.districtintel.engine.service;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.model.QualityMetrics;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Read-only view of the latest cycle's quality plus the alert predicate.
 * Delivering alerts is left to the caller.
 */
@Component
@RequiredArgsConstructor
public class QualityMonitor {

    private final DistrictStoreHolder holder;
    private final DistrictEngineProperties properties;

    public QualityMetrics summarize() {
        return holder.current().metrics();
    }

    public boolean shouldAlert() {
        return shouldAlert(summarize());
    }

    public boolean shouldAlert(QualityMetrics metrics) {
        return metrics.getCompletenessScore() < properties.getQuality().getAlertThreshold();
    }
}
