package com.districtintel.engine.model;

import lombok.Builder;
import lombok.Value;

/**
 * One source row: a single district for a single reporting period.
 *
 * Numeric metrics stay as the text the source delivered. Parsing happens in the
 * validator so that an unparseable value degrades to a default instead of
 * rejecting the whole row.
 */
@Value
@Builder
public class RawRecord {

    // ── Identity ────────────────────────────────────────────────────────────
    /** Required. Null when the source value was missing or not a string. */
    String districtId;

    /** Optional display name, falls back to districtId when blank */
    String districtName;

    /** Used for list filtering, e.g. "UTTAR PRADESH" */
    String stateName;

    /** Sortable period token, normally YYYY-MM */
    String period;

    // ── Metrics (raw text, null when absent) ────────────────────────────────
    String employedCount;

    String paymentSpeedPct;

    String workAvailabilityValue;

    String stateComparisonValue;
}
