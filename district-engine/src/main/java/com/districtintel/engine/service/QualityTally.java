package com.districtintel.engine.service;

import com.districtintel.engine.model.QualityMetrics;

/**
 * Mutable counters for a single ingestion cycle. Owned by one builder call,
 * never shared between threads.
 */
public class QualityTally {

    private long totalRows;
    private long validRows;
    private long invalidRows;
    private long skippedDistricts;
    private long warningCount;
    private double fieldCompletenessSum;

    long recordRow(double fieldCompleteness) {
        fieldCompletenessSum += fieldCompleteness;
        return ++totalRows;
    }

    void recordAccepted() {
        validRows++;
    }

    void recordRejected() {
        invalidRows++;
        skippedDistricts++;
    }

    void recordWarnings(int count) {
        warningCount += count;
    }

    public long totalRows() {
        return totalRows;
    }

    public long validRows() {
        return validRows;
    }

    public QualityMetrics toMetrics(int districtCount) {
        return QualityMetrics.builder()
                .totalRows(totalRows)
                .validRows(validRows)
                .invalidRows(invalidRows)
                .skippedDistricts(skippedDistricts)
                .warningCount(warningCount)
                .districtCount(districtCount)
                .completenessScore(totalRows == 0 ? 0 : (double) validRows / totalRows * 100)
                .fieldCompletenessScore(totalRows == 0 ? 0 : fieldCompletenessSum / totalRows * 100)
                .build();
    }
}
