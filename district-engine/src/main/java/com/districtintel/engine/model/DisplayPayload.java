package com.districtintel.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Display-ready view of one district. Every label is either a classified value,
 * a predicted value, or the "no data" label.
 */
@Value
@Builder
public class DisplayPayload {

    String districtId;
    String districtName;

    String workAvailability;
    String workAvailabilityColor;

    String paymentSpeed;
    String paymentSpeedColor;

    String peopleEmployed;

    String stateComparison;
    String stateComparisonColor;

    /** Most recent first */
    List<Double> historicalEmployed;

    MlInsights mlInsights;

    Map<String, String> helpText;
}
