package com.districtintel.engine.service;

import com.districtintel.engine.model.QualityMetrics;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.model.RefreshRun;
import com.districtintel.engine.source.RowSourceRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Orchestrates one refresh cycle: fetch a full snapshot from the active source,
 * rebuild the store, report quality.
 *
 * Failures are recorded on the {@link RefreshRun} and rethrown; the engine never
 * retries on its own.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DistrictRefreshService {

    private static final int RUN_HISTORY = 20;

    private final RowSourceRouter router;
    private final DistrictEngineService engine;
    private final QualityMonitor qualityMonitor;
    private final QualityLogSink qualitySink;

    private final Deque<RefreshRun> recentRuns = new ArrayDeque<>();

    // held across fetch and rebuild so overlapping triggers publish in fetch order
    private final ReentrantLock refreshLock = new ReentrantLock();

    public RefreshRun refresh() {
        refreshLock.lock();
        try {
            return runCycle();
        } finally {
            refreshLock.unlock();
        }
    }

    public synchronized List<RefreshRun> recentRuns() {
        return new ArrayList<>(recentRuns);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private RefreshRun runCycle() {
        RefreshRun run = RefreshRun.builder()
                .runId(UUID.randomUUID().toString())
                .source(router.activeMode().name())
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        qualitySink.info("Starting data refresh from " + run.getSource() + " source...");
        try {
            List<RawRecord> rows = router.fetchRows();
            run.setRowsFetched(rows.size());

            QualityMetrics metrics = engine.rebuild(rows);
            run.setDistrictsPublished(metrics.getDistrictCount());
            run.setStatus("SUCCESS");

            report(metrics);
            return run;

        } catch (RuntimeException e) {
            log.error("Refresh {} failed: {}", run.getRunId(), e.getMessage());
            qualitySink.error("Error loading data: " + e.getMessage());
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
            throw e;
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            remember(run);
        }
    }

    private void report(QualityMetrics metrics) {
        qualitySink.info(String.format(
                "Data parsing completed. Total rows: %d, Valid: %d, Invalid: %d, Districts: %d",
                metrics.getTotalRows(), metrics.getValidRows(), metrics.getInvalidRows(), metrics.getDistrictCount()));
        qualitySink.info(String.format(Locale.ROOT, "Data completeness: %.2f%%", metrics.getCompletenessScore()));

        if (qualityMonitor.shouldAlert(metrics)) {
            qualitySink.error(String.format(Locale.ROOT,
                    "ALERT: Data completeness is low (%.2f%%). Check data source.", metrics.getCompletenessScore()));
        }
    }

    private synchronized void remember(RefreshRun run) {
        recentRuns.addFirst(run);
        while (recentRuns.size() > RUN_HISTORY) {
            recentRuns.removeLast();
        }
    }
}
