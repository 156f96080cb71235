package com.districtintel.engine.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MlInsights {

    /** Trend-based estimate, set only when the raw employment figure is missing */
    Double predictedEmployment;

    /** Rule-based category, set only when the raw payment speed is missing */
    String predictedPaymentSpeed;

    Double forecastedEmployment;

    boolean anomaly;

    /** Human-readable alert, null when not anomalous */
    String anomalyAlert;
}
