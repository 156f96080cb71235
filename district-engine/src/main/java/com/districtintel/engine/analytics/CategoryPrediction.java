package com.districtintel.engine.analytics;

/**
 * @param trend direction of the employment figure against the history mean
 * @param tier  0 = top, 1 = middle, 2 = bottom
 * @param label display label of the tier
 */
public record CategoryPrediction(Trend trend, int tier, String label) {}
