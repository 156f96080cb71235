package com.districtintel.engine.config;

import com.districtintel.engine.analytics.ClusterReport;
import com.districtintel.engine.analytics.MlFeatureFlags;
import com.districtintel.engine.model.DistrictSummary;
import com.districtintel.engine.model.RefreshRun;
import com.districtintel.engine.service.DistrictEngineService;
import com.districtintel.engine.service.DistrictRefreshService;
import com.districtintel.engine.source.SourceUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api")
@Slf4j
@RequiredArgsConstructor
public class DistrictController {

    private static final Map<String, String> NOT_FOUND = Map.of("error", "District not found.");

    private final DistrictEngineService engine;
    private final DistrictRefreshService refreshService;
    private final DistrictEngineProperties properties;

    // ── Districts ─────────────────────────────────────────────────────────────

    /**
     * GET /api/districts?state=UTTAR+PRADESH
     *
     * Omitting state applies the configured default; state= (empty) lists every district.
     */
    @GetMapping("/districts")
    public List<DistrictSummary> listDistricts(@RequestParam(required = false) String state) {
        String filter = state != null ? state : properties.getListing().getDefaultState();
        return engine.listDistricts(filter);
    }

    @GetMapping("/data/{districtId}")
    public ResponseEntity<?> getDistrictData(@PathVariable String districtId) {
        return found(engine.getDisplayPayload(districtId));
    }

    @GetMapping("/data-quality")
    public Map<String, Object> dataQuality() {
        return Map.of(
                "metrics", engine.getQuality(),
                "lastUpdated", Instant.now().toString());
    }

    // ── Refresh ───────────────────────────────────────────────────────────────

    @PostMapping("/data-refresh")
    public ResponseEntity<Map<String, Object>> refresh() {
        try {
            RefreshRun run = refreshService.refresh();
            return ResponseEntity.ok(Map.of(
                    "message", "Data refreshed successfully",
                    "timestamp", Instant.now().toString(),
                    "run", run,
                    "metrics", engine.getQuality()));
        } catch (SourceUnavailableException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Failed to refresh data: " + e.getMessage()));
        } catch (Exception e) {
            log.error("Manual refresh failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Failed to refresh data."));
        }
    }

    @GetMapping("/refresh/status")
    public Map<String, Object> refreshStatus() {
        return Map.of(
                "service", "district-intel-engine",
                "source", properties.getSource().getMode(),
                "recentRuns", refreshService.recentRuns());
    }

    // ── ML insights ───────────────────────────────────────────────────────────

    @GetMapping("/ml/predict-employment/{districtId}")
    public ResponseEntity<?> predictEmployment(@PathVariable String districtId) {
        return found(engine.predictEmployment(districtId));
    }

    @GetMapping("/ml/classify-payment/{districtId}")
    public ResponseEntity<?> classifyPayment(@PathVariable String districtId) {
        return found(engine.classifyPaymentSpeed(districtId));
    }

    @GetMapping("/ml/forecast-employment/{districtId}")
    public ResponseEntity<?> forecastEmployment(@PathVariable String districtId) {
        return found(engine.forecastEmployment(districtId));
    }

    @GetMapping("/ml/detect-anomaly/{districtId}")
    public ResponseEntity<?> detectAnomaly(@PathVariable String districtId) {
        return engine.detectAnomaly(districtId)
                .<ResponseEntity<?>>map(estimate -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("districtId", estimate.districtId());
                    body.put("isAnomaly", estimate.isAvailable() && estimate.value().anomalous());
                    body.put("zScore", estimate.isAvailable() ? estimate.value().zScore() : null);
                    body.put("method", estimate.method());
                    body.put("threshold", "2_std_deviations");
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(NOT_FOUND));
    }

    @GetMapping("/ml/cluster-districts")
    public ClusterReport clusterDistricts() {
        return engine.clusterDistricts();
    }

    @GetMapping("/ml/config")
    public MlFeatureFlags mlConfig() {
        return engine.mlFeatures();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private ResponseEntity<?> found(Optional<?> result) {
        return result.<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(NOT_FOUND));
    }
}
