package com.districtintel.engine.service;

import java.util.List;

/**
 * Outcome of validating one row.
 *
 * @param warnings        non-fatal problems; the row is kept with defaults
 * @param rejectionReason set only when the row is rejected
 */
public record ValidationResult(boolean accepted, List<String> warnings, RejectionReason rejectionReason) {

    public static ValidationResult accepted(List<String> warnings) {
        return new ValidationResult(true, List.copyOf(warnings), null);
    }

    public static ValidationResult rejected(RejectionReason reason, List<String> warnings) {
        return new ValidationResult(false, List.copyOf(warnings), reason);
    }
}
