package com.districtintel.engine.rules;

/**
 * Better/worse split on a single scalar cutoff.
 */
public record ThresholdStateComparisonPolicy(double cutoff,
                                             Classification better,
                                             Classification worse) implements StateComparisonPolicy {

    public static ThresholdStateComparisonPolicy withCutoff(double cutoff) {
        return new ThresholdStateComparisonPolicy(cutoff,
                new Classification("Better", "green"),
                new Classification("Worse", "red"));
    }

    @Override
    public Classification compare(double value) {
        return value > cutoff ? better : worse;
    }
}
