package com.districtintel.engine.rules;

/**
 * Display metrics the rule engine knows how to classify or format.
 */
public enum Metric {
    WORK_AVAILABILITY,
    PAYMENT_SPEED,
    PEOPLE_EMPLOYED,
    STATE_COMPARISON
}
