package com.districtintel.engine.rules;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Immutable display rules. Built once at startup and handed to the {@link RuleEngine}.
 */
@Value
@Builder(toBuilder = true)
public class RuleConfig {

    TierRule workAvailability;
    TierRule paymentSpeed;
    StateComparisonPolicy stateComparison;
    MagnitudeFormat magnitude;

    /** Shown in place of a label when the raw value is missing or zero */
    @Builder.Default
    Classification unavailable = new Classification("Data Not Available", "gray");

    /** Color for labels that come from an estimator rather than the source */
    @Builder.Default
    String predictedColor = "blue";

    @Builder.Default
    String predictedSuffix = " (Predicted)";

    @Singular("helpText")
    Map<String, String> helpText;

    public static RuleConfig defaults() {
        return withThresholds(150_000, 75_000, 80, 50, 100_000);
    }

    public static RuleConfig withThresholds(double workHigh, double workMedium,
                                            double paymentGood, double paymentOkay,
                                            double stateCutoff) {
        return RuleConfig.builder()
                .workAvailability(TierRule.of(
                        List.of(workHigh, workMedium),
                        List.of("High", "Medium", "Low"),
                        List.of("green", "yellow", "red")))
                .paymentSpeed(TierRule.of(
                        List.of(paymentGood, paymentOkay),
                        List.of("Good", "Okay", "Bad"),
                        List.of("green", "yellow", "red")))
                .stateComparison(ThresholdStateComparisonPolicy.withCutoff(stateCutoff))
                .magnitude(MagnitudeFormat.indian())
                .helpText("workAvailability",
                        "This shows if enough work is being created for eligible applicants in the district.")
                .helpText("paymentSpeed",
                        "This indicates how quickly payments are processed and disbursed to workers.")
                .helpText("peopleEmployed",
                        "Number of people employed under MGNREGA in the district.")
                .helpText("stateComparison",
                        "Comparison of district performance against the state average.")
                .helpText("historicalEmployed", "Employment trend over the last 6 months.")
                .helpText("mlInsights",
                        "Machine learning predictions and insights for missing data and trends.")
                .build();
    }
}
