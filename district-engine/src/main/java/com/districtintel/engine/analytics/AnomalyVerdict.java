package com.districtintel.engine.analytics;

/**
 * @param zScore |value − mean| / stdDev, 0 when the history has no spread
 */
public record AnomalyVerdict(boolean anomalous, double zScore) {}
