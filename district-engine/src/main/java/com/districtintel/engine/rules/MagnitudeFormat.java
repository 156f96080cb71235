package com.districtintel.engine.rules;

import java.math.BigDecimal;
import java.util.Locale;

/**
 * Scales large counts to a unit label, e.g. 145000 → "1.45 Lakh".
 */
public record MagnitudeFormat(double largeUnit, String largeLabel,
                              double mediumUnit, String mediumLabel) {

    public static MagnitudeFormat indian() {
        return new MagnitudeFormat(100_000, "Lakh", 1_000, "Thousand");
    }

    public String format(double value) {
        if (value >= largeUnit) return scaled(value / largeUnit, largeLabel);
        if (value >= mediumUnit) return scaled(value / mediumUnit, mediumLabel);
        return plain(value);
    }

    private static String scaled(double value, String label) {
        return String.format(Locale.ROOT, "%.2f %s", value, label);
    }

    // 500 → "500", 12.5 → "12.5"
    private static String plain(double value) {
        if (value == Math.rint(value) && Math.abs(value) < Long.MAX_VALUE) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
