package com.districtintel.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * Data quality counters for one ingestion cycle. Recomputed from scratch each
 * cycle, never accumulated across cycles.
 */
@Value
@Builder
public class QualityMetrics {

    long totalRows;
    long validRows;
    long invalidRows;
    long skippedDistricts;

    /** Degraded-but-kept field events across all rows */
    long warningCount;

    /** Distinct districts published to the store */
    int districtCount;

    /** validRows / totalRows × 100, 0 for an empty snapshot */
    double completenessScore;

    /** Mean share of required fields present and valid, as a percentage */
    double fieldCompletenessScore;

    public static QualityMetrics empty() {
        return QualityMetrics.builder().build();
    }
}
