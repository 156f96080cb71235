package com.districtintel.engine.rules;

import lombok.RequiredArgsConstructor;

/**
 * Maps raw metric values to labels, colors and display strings.
 *
 * Pure: output depends only on the {@link RuleConfig} and the input value.
 */
@RequiredArgsConstructor
public class RuleEngine {

    private final RuleConfig config;

    /**
     * Classify a value that is known to be present.
     *
     * @throws IllegalArgumentException for zero, negative or non-finite values, or a
     *                                  metric that has no classification rule
     */
    public Classification classify(Metric metric, double value) {
        if (!hasData(value)) {
            throw new IllegalArgumentException("No data to classify for " + metric + ": " + value);
        }
        return switch (metric) {
            case WORK_AVAILABILITY -> config.getWorkAvailability().classify(value);
            case PAYMENT_SPEED -> config.getPaymentSpeed().classify(value);
            case STATE_COMPARISON -> config.getStateComparison().compare(value);
            case PEOPLE_EMPLOYED -> throw new IllegalArgumentException(metric + " is formatted, not classified");
        };
    }

    /** Like {@link #classify} but yields the "no data" state instead of throwing for missing values. */
    public Classification describe(Metric metric, double value) {
        return hasData(value) ? classify(metric, value) : config.getUnavailable();
    }

    public String format(Metric metric, double value) {
        return config.getMagnitude().format(value);
    }

    public String formatPredicted(Metric metric, double value) {
        return format(metric, value) + config.getPredictedSuffix();
    }

    public boolean hasData(double value) {
        return Double.isFinite(value) && value > 0;
    }

    public RuleConfig config() {
        return config;
    }
}
