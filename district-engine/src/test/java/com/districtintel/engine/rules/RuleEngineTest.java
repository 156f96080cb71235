package com.districtintel.engine.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RuleEngine Unit Tests")
class RuleEngineTest {

    private final RuleEngine ruleEngine = new RuleEngine(RuleConfig.defaults());

    @Nested
    @DisplayName("classify")
    class Classify {

        @ParameterizedTest(name = "work availability {0} → {1}/{2}")
        @CsvSource({
                "150001, High, green",
                "150000, Medium, yellow",
                "75001, Medium, yellow",
                "75000, Low, red",
                "1, Low, red"
        })
        void workAvailabilityTiers(double value, String label, String color) {
            assertThat(ruleEngine.classify(Metric.WORK_AVAILABILITY, value))
                    .isEqualTo(new Classification(label, color));
        }

        @ParameterizedTest(name = "payment speed {0} → {1}")
        @CsvSource({
                "95, Good",
                "80, Okay",
                "50.5, Okay",
                "50, Bad",
                "3, Bad"
        })
        void paymentSpeedTiers(double value, String label) {
            assertThat(ruleEngine.classify(Metric.PAYMENT_SPEED, value).label()).isEqualTo(label);
        }

        @Test
        @DisplayName("State comparison splits on the configured cutoff")
        void stateComparisonUsesCutoff() {
            assertThat(ruleEngine.classify(Metric.STATE_COMPARISON, 100_001))
                    .isEqualTo(new Classification("Better", "green"));
            assertThat(ruleEngine.classify(Metric.STATE_COMPARISON, 100_000))
                    .isEqualTo(new Classification("Worse", "red"));
        }

        @Test
        @DisplayName("Zero, negative and NaN values are refused")
        void refusesMissingValues() {
            assertThatThrownBy(() -> ruleEngine.classify(Metric.PAYMENT_SPEED, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ruleEngine.classify(Metric.PAYMENT_SPEED, -4))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ruleEngine.classify(Metric.WORK_AVAILABILITY, Double.NaN))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("describe yields the no-data state instead of throwing")
        void describeFallsBackToUnavailable() {
            assertThat(ruleEngine.describe(Metric.WORK_AVAILABILITY, 0))
                    .isEqualTo(new Classification("Data Not Available", "gray"));
            assertThat(ruleEngine.describe(Metric.WORK_AVAILABILITY, 200_000).label()).isEqualTo("High");
        }

        @Test
        @DisplayName("A swapped comparison policy is honoured")
        void customComparisonPolicy() {
            RuleConfig config = RuleConfig.defaults().toBuilder()
                    .stateComparison(value -> new Classification("Above state average", "teal"))
                    .build();

            assertThat(new RuleEngine(config).classify(Metric.STATE_COMPARISON, 5).label())
                    .isEqualTo("Above state average");
        }
    }

    @Nested
    @DisplayName("format")
    class Format {

        @ParameterizedTest(name = "{0} → \"{1}\"")
        @CsvSource({
                "145000, 1.45 Lakh",
                "100000, 1.00 Lakh",
                "2350000, 23.50 Lakh",
                "1500, 1.50 Thousand",
                "99999, 100.00 Thousand",
                "1000, 1.00 Thousand",
                "500, 500",
                "12.5, 12.5"
        })
        void magnitudes(double value, String expected) {
            assertThat(ruleEngine.format(Metric.PEOPLE_EMPLOYED, value)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Predicted values carry the suffix")
        void predictedSuffix() {
            assertThat(ruleEngine.formatPredicted(Metric.PEOPLE_EMPLOYED, 70_000))
                    .isEqualTo("70.00 Thousand (Predicted)");
        }
    }

    @Test
    @DisplayName("TierRule rejects unordered cut points and mismatched labels")
    void tierRuleValidation() {
        assertThatThrownBy(() -> TierRule.of(List.of(10.0, 20.0), List.of("a", "b", "c"), List.of("x", "y", "z")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("high to low");
        assertThatThrownBy(() -> TierRule.of(List.of(10.0), List.of("a"), List.of("x", "y")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
