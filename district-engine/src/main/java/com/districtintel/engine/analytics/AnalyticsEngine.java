package com.districtintel.engine.analytics;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Runs the five estimators behind their feature flags.
 *
 * Each method returns an empty result when its estimator is switched off, so
 * callers cannot tell "disabled" from "not enough data". Both mean the same thing
 * to the display: no estimate.
 */
@Slf4j
public class AnalyticsEngine {

    private final MlFeatureFlags flags;
    private final TrendPredictor trendPredictor = new TrendPredictor();
    private final CategoryClassifier categoryClassifier;
    private final SmoothingForecaster forecaster = new SmoothingForecaster();
    private final AnomalyDetector anomalyDetector = new AnomalyDetector();
    private final DistrictClusterer clusterer;

    public AnalyticsEngine(MlFeatureFlags flags, List<String> categoryLabels, ClusterPolicy clusterPolicy) {
        this.flags = flags;
        this.categoryClassifier = new CategoryClassifier(categoryLabels);
        this.clusterer = new DistrictClusterer(clusterPolicy);
        log.info("Analytics engine ready: {}", flags);
    }

    public OptionalDouble predictEmployment(double[] chronological) {
        if (!flags.trendPredictionActive()) return OptionalDouble.empty();
        return trendPredictor.predictNext(chronological);
    }

    public Optional<CategoryPrediction> classifyPaymentSpeed(double employment, double[] chronological) {
        if (!flags.classificationActive()) return Optional.empty();
        return categoryClassifier.classify(employment, chronological);
    }

    public OptionalDouble forecastEmployment(double[] chronological) {
        if (!flags.forecastActive()) return OptionalDouble.empty();
        return forecaster.forecast(chronological);
    }

    public Optional<AnomalyVerdict> detectAnomaly(double value, double[] chronological) {
        if (!flags.anomalyDetectionActive()) return Optional.empty();
        return anomalyDetector.detect(value, chronological);
    }

    public ClusterReport clusterDistricts(List<ClusterPoint> points) {
        List<ClusterCentroid> centroids = clusterer.policy().centroids();
        Map<Integer, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < centroids.size(); i++) {
            labels.put(i, centroids.get(i).label());
        }

        Map<Integer, List<String>> clusters = flags.clusteringActive()
                ? clusterer.cluster(points)
                : Map.of();
        return new ClusterReport(clusters, "k_means_clustering", centroids.size(), labels);
    }

    public MlFeatureFlags flags() {
        return flags;
    }
}
