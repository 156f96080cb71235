package com.districtintel.engine.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Tracks each refresh cycle for observability.
 */
@Data
@Builder
public class RefreshRun {

    private String runId;           // UUID
    private String source;          // CSV | CLOUD | CLICKHOUSE
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String status;          // RUNNING | SUCCESS | FAILED
    private int rowsFetched;
    private int districtsPublished;
    private String errorMessage;    // null on success
}
