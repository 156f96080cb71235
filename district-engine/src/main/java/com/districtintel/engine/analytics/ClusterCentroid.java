package com.districtintel.engine.analytics;

public record ClusterCentroid(String label, double employment, double paymentSpeed) {}
