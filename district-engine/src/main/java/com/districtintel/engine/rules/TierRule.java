package com.districtintel.engine.rules;

import java.util.List;

/**
 * Ordered thresholds for one tiered metric.
 *
 * cutPoints are sorted high to low; a value above cutPoints[i] lands in tier i,
 * anything not above the last cut point lands in the floor tier. labels and colors
 * therefore carry one more element than cutPoints.
 */
public final class TierRule {

    private final List<Double> cutPoints;
    private final List<String> labels;
    private final List<String> colors;

    private TierRule(List<Double> cutPoints, List<String> labels, List<String> colors) {
        this.cutPoints = List.copyOf(cutPoints);
        this.labels = List.copyOf(labels);
        this.colors = List.copyOf(colors);
    }

    public static TierRule of(List<Double> cutPoints, List<String> labels, List<String> colors) {
        if (cutPoints.isEmpty()) {
            throw new IllegalArgumentException("At least one cut point is required");
        }
        if (labels.size() != cutPoints.size() + 1 || colors.size() != cutPoints.size() + 1) {
            throw new IllegalArgumentException("Expected " + (cutPoints.size() + 1)
                    + " labels and colors, got " + labels.size() + " and " + colors.size());
        }
        for (int i = 1; i < cutPoints.size(); i++) {
            if (cutPoints.get(i) > cutPoints.get(i - 1)) {
                throw new IllegalArgumentException("Cut points must be ordered high to low: " + cutPoints);
            }
        }
        return new TierRule(cutPoints, labels, colors);
    }

    /** Index of the first tier whose cut point the value exceeds, or the floor tier. */
    public int tierOf(double value) {
        for (int i = 0; i < cutPoints.size(); i++) {
            if (value > cutPoints.get(i)) return i;
        }
        return cutPoints.size();
    }

    public Classification classify(double value) {
        int tier = tierOf(value);
        return new Classification(labels.get(tier), colors.get(tier));
    }

    public List<String> labels() {
        return labels;
    }

    public List<Double> cutPoints() {
        return cutPoints;
    }
}
