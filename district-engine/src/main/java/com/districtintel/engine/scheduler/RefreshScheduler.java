package com.districtintel.engine.scheduler;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.config.DistrictEngineProperties.Source.SourceMode;
import com.districtintel.engine.service.DistrictRefreshService;
import com.districtintel.engine.source.ClickHouseRowSource;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup refreshes.
 *
 * Default schedule: daily at 03:00 UTC. Override with REFRESH_CRON or
 * district-engine.scheduling.cron.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RefreshScheduler {

    private final DistrictRefreshService refreshService;
    private final ClickHouseRowSource clickHouseSource;
    private final DistrictEngineProperties properties;

    /**
     * On application startup:
     *  1. Ensure the source table exists when reading from ClickHouse
     *  2. Load the first snapshot if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        if (properties.getSource().getMode() == SourceMode.CLICKHOUSE) {
            try {
                clickHouseSource.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, loading initial snapshot");
            runRefresh("Startup");
        } else {
            log.info("Engine ready with an empty store. Next scheduled refresh: {}",
                    properties.getScheduling().getCron());
        }
    }

    @Scheduled(cron = "${district-engine.scheduling.cron:0 0 3 * * ?}", zone = "UTC")
    public void scheduledRefresh() {
        log.info("Scheduled refresh triggered");
        runRefresh("Scheduled");
    }

    private void runRefresh(String trigger) {
        try {
            refreshService.refresh();
        } catch (Exception e) {
            // previous snapshot keeps serving; next trigger tries again
            log.error("{} refresh failed: {}", trigger, e.getMessage(), e);
        }
    }
}
