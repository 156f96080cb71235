package com.districtintel.engine.analytics;

import lombok.Builder;
import lombok.Value;

/**
 * Master switch plus one switch per estimator. An estimator runs only when both
 * the master switch and its own switch are on.
 */
@Value
@Builder
public class MlFeatureFlags {

    @Builder.Default boolean enabled = true;
    @Builder.Default boolean linearRegression = true;
    @Builder.Default boolean classification = true;
    @Builder.Default boolean timeSeriesForecasting = true;
    @Builder.Default boolean anomalyDetection = true;
    @Builder.Default boolean clustering = true;

    public static MlFeatureFlags allEnabled() {
        return MlFeatureFlags.builder().build();
    }

    public boolean trendPredictionActive() {
        return enabled && linearRegression;
    }

    public boolean classificationActive() {
        return enabled && classification;
    }

    public boolean forecastActive() {
        return enabled && timeSeriesForecasting;
    }

    public boolean anomalyDetectionActive() {
        return enabled && anomalyDetection;
    }

    public boolean clusteringActive() {
        return enabled && clustering;
    }
}
