package com.districtintel.engine.service;

import com.districtintel.engine.model.RawRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Grades raw rows before they reach the store.
 *
 * Only a missing district id rejects a row. Everything else degrades to a default
 * and is reported as a warning.
 */
@Component
@RequiredArgsConstructor
public class RecordValidator {

    private static final int REQUIRED_FIELDS = 4;

    private final QualityLogSink qualitySink;

    public ValidationResult validate(RawRecord record, QualityTally tally) {
        String districtId = record.getDistrictId();
        long rowNumber = tally.recordRow(fieldCompleteness(record));

        if (!isValidString(districtId)) {
            tally.recordRejected();
            qualitySink.error(String.format("Invalid districtId: %s, skipping row %d", districtId, rowNumber));
            return ValidationResult.rejected(RejectionReason.MISSING_DISTRICT_ID, List.of());
        }

        List<String> warnings = new ArrayList<>();
        if (!isValidString(record.getDistrictName())) {
            warnings.add("Missing districtName for districtId: " + districtId);
        }
        checkNumeric(warnings, districtId, "employedCount", record.getEmployedCount());
        checkNumeric(warnings, districtId, "paymentSpeedPct", record.getPaymentSpeedPct());

        warnings.forEach(qualitySink::warn);
        tally.recordWarnings(warnings.size());
        tally.recordAccepted();
        return ValidationResult.accepted(warnings);
    }

    /**
     * Parse a metric, substituting the default and reporting a warning when the
     * value is not a finite number.
     */
    public double parseNumericSafe(String field, String raw, double defaultValue) {
        if (isValidNumeric(raw)) {
            return Double.parseDouble(raw.trim());
        }
        qualitySink.warn(String.format("Invalid numeric value for %s: %s, using default: %s",
                field, raw, defaultValue));
        return defaultValue;
    }

    // ── Static helpers ───────────────────────────────────────────────────────

    /** Same rule as {@link #parseNumericSafe} without the warning. */
    public static double parseOrDefault(String raw, double defaultValue) {
        return isValidNumeric(raw) ? Double.parseDouble(raw.trim()) : defaultValue;
    }

    public static boolean isValidNumeric(String raw) {
        if (raw == null || raw.isBlank()) return false;
        try {
            // BigDecimal rejects "NaN", "Infinity", hex and the d/f suffixes Double accepts
            return Double.isFinite(new BigDecimal(raw.trim()).doubleValue());
        } catch (NumberFormatException e) {
            return false;
        }
    }

    public static boolean isValidString(String value) {
        return value != null && !value.isBlank();
    }

    private void checkNumeric(List<String> warnings, String districtId, String field, String raw) {
        if (!isValidNumeric(raw)) {
            warnings.add(String.format("Invalid %s for districtId: %s: %s, using default: 0",
                    field, districtId, raw));
        }
    }

    private double fieldCompleteness(RawRecord record) {
        int valid = 0;
        if (isValidString(record.getDistrictId())) valid++;
        if (isValidString(record.getDistrictName())) valid++;
        if (isValidNumeric(record.getEmployedCount())) valid++;
        if (isValidNumeric(record.getPaymentSpeedPct())) valid++;
        return (double) valid / REQUIRED_FIELDS;
    }
}
