package com.districtintel.engine.model;

/**
 * Result of one estimator query for one district.
 *
 * @param districtId district the estimate was computed for
 * @param method     estimator name, e.g. "linear_regression"
 * @param value      the estimate, or null when unavailable (too little history
 *                   or the estimator is switched off)
 * @param confidence coarse confidence label
 */
public record Estimate<T>(String districtId, String method, T value, String confidence) {

    public boolean isAvailable() {
        return value != null;
    }
}
