package com.districtintel.engine.analytics;

import java.util.List;
import java.util.Optional;

/**
 * Rule-based payment-speed category derived from employment performance.
 *
 * IMPROVING and above 100,000 → top tier, IMPROVING and above 50,000 → middle tier,
 * anything else → bottom tier.
 */
public class CategoryClassifier {

    static final double TOP_TIER_CUTOFF = 100_000;
    static final double MIDDLE_TIER_CUTOFF = 50_000;

    private final List<String> tierLabels;

    public CategoryClassifier(List<String> tierLabels) {
        if (tierLabels.size() != 3) {
            throw new IllegalArgumentException("Exactly three tier labels required, got " + tierLabels);
        }
        this.tierLabels = List.copyOf(tierLabels);
    }

    public Optional<CategoryPrediction> classify(double employment, double[] history) {
        if (history.length == 0) return Optional.empty();

        double mean = 0;
        for (double v : history) mean += v;
        mean /= history.length;

        Trend trend = employment > mean ? Trend.IMPROVING : Trend.DECLINING;

        int tier;
        if (trend == Trend.IMPROVING && employment > TOP_TIER_CUTOFF) tier = 0;
        else if (trend == Trend.IMPROVING && employment > MIDDLE_TIER_CUTOFF) tier = 1;
        else tier = 2;

        return Optional.of(new CategoryPrediction(trend, tier, tierLabels.get(tier)));
    }
}
