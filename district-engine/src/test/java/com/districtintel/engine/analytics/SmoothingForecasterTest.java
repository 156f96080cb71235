package com.districtintel.engine.analytics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("SmoothingForecaster Unit Tests")
class SmoothingForecasterTest {

    private final SmoothingForecaster forecaster = new SmoothingForecaster();

    @Test
    @DisplayName("Constant history forecasts the constant")
    void constantHistory() {
        assertThat(forecaster.forecast(new double[]{5, 5, 5, 5, 5, 5}).getAsDouble())
                .isCloseTo(5.0, within(1e-9));
    }

    @Test
    @DisplayName("Seeds with the oldest value and blends forward")
    void blendsChronologically() {
        // 100 → 0.3*200 + 0.7*100 = 130 → 0.3*0 + 0.7*130 = 91
        assertThat(forecaster.forecast(new double[]{100, 200, 0}).getAsDouble())
                .isCloseTo(91.0, within(1e-9));
    }

    @Test
    @DisplayName("Single value forecasts itself, empty history forecasts nothing")
    void edgeLengths() {
        assertThat(forecaster.forecast(new double[]{42}).getAsDouble()).isEqualTo(42.0);
        assertThat(forecaster.forecast(new double[0])).isEmpty();
    }
}
