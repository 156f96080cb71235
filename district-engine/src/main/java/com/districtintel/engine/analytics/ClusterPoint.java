package com.districtintel.engine.analytics;

public record ClusterPoint(String districtId, double employment, double paymentSpeed) {}
