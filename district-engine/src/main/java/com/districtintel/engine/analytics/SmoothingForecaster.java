package com.districtintel.engine.analytics;

import java.util.OptionalDouble;

/**
 * Simple exponential smoothing with a fixed factor.
 */
public class SmoothingForecaster {

    public static final double ALPHA = 0.3;

    public OptionalDouble forecast(double[] chronological) {
        if (chronological.length == 0) return OptionalDouble.empty();

        double smoothed = chronological[0];
        for (int i = 1; i < chronological.length; i++) {
            smoothed = ALPHA * chronological[i] + (1 - ALPHA) * smoothed;
        }
        return OptionalDouble.of(Math.max(0, smoothed));
    }
}
