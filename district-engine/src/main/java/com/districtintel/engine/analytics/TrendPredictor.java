package com.districtintel.engine.analytics;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * Ordinary least squares over the positive points of a series, extrapolated one
 * step ahead.
 */
public class TrendPredictor {

    static final int MIN_POINTS = 2;

    /**
     * @param chronological series oldest first
     * @return the fitted value at index n+1 clamped to 0, or empty with fewer than
     *         two positive points
     */
    public OptionalDouble predictNext(double[] chronological) {
        double[] y = Arrays.stream(chronological)
                .filter(v -> Double.isFinite(v) && v > 0)
                .toArray();
        int n = y.length;
        if (n < MIN_POINTS) return OptionalDouble.empty();

        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            double x = i + 1;
            sumX += x;
            sumY += y[i];
            sumXY += x * y[i];
            sumXX += x * x;
        }
        // x values are distinct, so the denominator is never zero for n >= 2
        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;

        return OptionalDouble.of(Math.max(0, slope * (n + 1) + intercept));
    }
}
