package com.districtintel.engine.rules;

/**
 * Decides how a district compares against its state.
 *
 * The shipped implementation is a fixed cutoff, not a real state average.
 * Swap the bean once state-level aggregates are available.
 */
public interface StateComparisonPolicy {

    Classification compare(double value);
}
