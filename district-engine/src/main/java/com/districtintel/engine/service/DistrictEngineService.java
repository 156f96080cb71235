package com.districtintel.engine.service;

import com.districtintel.engine.analytics.AnalyticsEngine;
import com.districtintel.engine.analytics.AnomalyVerdict;
import com.districtintel.engine.analytics.CategoryPrediction;
import com.districtintel.engine.analytics.ClusterPoint;
import com.districtintel.engine.analytics.ClusterReport;
import com.districtintel.engine.analytics.MlFeatureFlags;
import com.districtintel.engine.model.DisplayPayload;
import com.districtintel.engine.model.DistrictEntry;
import com.districtintel.engine.model.DistrictSummary;
import com.districtintel.engine.model.Estimate;
import com.districtintel.engine.model.QualityMetrics;
import com.districtintel.engine.model.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Entry point to the engine: full-snapshot ingestion and all read operations.
 *
 * Reads never lock. Each read works on the snapshot that was current when it
 * started, so a concurrent {@link #rebuild} cannot expose a half-built store.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DistrictEngineService {

    private final DistrictStoreBuilder storeBuilder;
    private final DistrictStoreHolder holder;
    private final DisplayPayloadAssembler payloadAssembler;
    private final AnalyticsEngine analytics;

    // ── Ingestion ─────────────────────────────────────────────────────────────

    /**
     * Replace the store with one built from {@code rows}. If building fails the
     * previous snapshot stays in place.
     */
    public synchronized QualityMetrics rebuild(List<RawRecord> rows) {
        StoreSnapshot snapshot = storeBuilder.build(rows);
        StoreSnapshot previous = holder.publish(snapshot);
        log.info("Store replaced: {} → {} districts", previous.store().size(), snapshot.store().size());
        return snapshot.metrics();
    }

    // ── Reads ─────────────────────────────────────────────────────────────────

    public Optional<DistrictEntry> getDistrict(String districtId) {
        return holder.current().store().get(districtId);
    }

    /**
     * @param stateFilter exact state name, or null/blank for every district
     */
    public List<DistrictSummary> listDistricts(String stateFilter) {
        boolean filtered = RecordValidator.isValidString(stateFilter);
        return holder.current().store().entries().stream()
                .filter(e -> !filtered || stateFilter.equals(e.getLatest().getStateName()))
                .map(e -> new DistrictSummary(e.getDistrictId(),
                        RecordValidator.isValidString(e.getLatest().getDistrictName())
                                ? e.getLatest().getDistrictName()
                                : e.getDistrictId()))
                .toList();
    }

    public Optional<DisplayPayload> getDisplayPayload(String districtId) {
        return getDistrict(districtId).map(payloadAssembler::assemble);
    }

    public QualityMetrics getQuality() {
        return holder.current().metrics();
    }

    // ── Estimator queries ─────────────────────────────────────────────────────

    public Optional<Estimate<Double>> predictEmployment(String districtId) {
        return getDistrict(districtId).map(entry -> {
            Double value = boxed(analytics.predictEmployment(entry.chronologicalHistory()));
            return new Estimate<>(districtId, "linear_regression", value, confidence(value));
        });
    }

    public Optional<Estimate<String>> classifyPaymentSpeed(String districtId) {
        return getDistrict(districtId).map(entry -> {
            double employment = RecordValidator.parseOrDefault(entry.getLatest().getEmployedCount(), 0);
            String value = analytics.classifyPaymentSpeed(employment, entry.chronologicalHistory())
                    .map(CategoryPrediction::label)
                    .orElse(null);
            return new Estimate<>(districtId, "rule_based_classification", value, confidence(value));
        });
    }

    public Optional<Estimate<Double>> forecastEmployment(String districtId) {
        return getDistrict(districtId).map(entry -> {
            Double value = boxed(analytics.forecastEmployment(entry.chronologicalHistory()));
            return new Estimate<>(districtId, "exponential_smoothing", value, confidence(value));
        });
    }

    public Optional<Estimate<AnomalyVerdict>> detectAnomaly(String districtId) {
        return getDistrict(districtId).map(entry -> {
            double employment = RecordValidator.parseOrDefault(entry.getLatest().getEmployedCount(), 0);
            AnomalyVerdict value = analytics.detectAnomaly(employment, entry.chronologicalHistory()).orElse(null);
            return new Estimate<>(districtId, "z_score_detection", value, confidence(value));
        });
    }

    public ClusterReport clusterDistricts() {
        List<ClusterPoint> points = holder.current().store().entries().stream()
                .map(e -> new ClusterPoint(e.getDistrictId(),
                        RecordValidator.parseOrDefault(e.getLatest().getEmployedCount(), 0),
                        RecordValidator.parseOrDefault(e.getLatest().getPaymentSpeedPct(), 0)))
                .toList();
        return analytics.clusterDistricts(points);
    }

    public MlFeatureFlags mlFeatures() {
        return analytics.flags();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }

    private static String confidence(Object value) {
        return value != null ? "medium" : "low";
    }
}
