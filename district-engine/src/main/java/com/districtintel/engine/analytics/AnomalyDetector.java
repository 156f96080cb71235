package com.districtintel.engine.analytics;

import java.util.Optional;

/**
 * Z-score test against the population mean and standard deviation of a series.
 */
public class AnomalyDetector {

    public static final double Z_THRESHOLD = 2.0;

    public Optional<AnomalyVerdict> detect(double value, double[] history) {
        if (history.length == 0) return Optional.empty();

        double mean = 0;
        double min = history[0];
        double max = history[0];
        for (double v : history) {
            mean += v;
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        mean /= history.length;

        // flat history: nothing can be judged unusual. A computed std-dev of a flat
        // fractional series is not reliably 0, so compare the extremes
        if (min == max) return Optional.of(new AnomalyVerdict(false, 0));

        double variance = 0;
        for (double v : history) variance += (v - mean) * (v - mean);
        variance /= history.length;
        double stdDev = Math.sqrt(variance);

        double z = Math.abs(value - mean) / stdDev;
        return Optional.of(new AnomalyVerdict(z > Z_THRESHOLD, z));
    }
}
