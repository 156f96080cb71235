package com.districtintel.engine.model;

/**
 * List entry for the district picker.
 */
public record DistrictSummary(String id, String name) {}
