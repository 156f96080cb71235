package com.districtintel.engine.rules;

/**
 * A display label and the color it is rendered with.
 */
public record Classification(String label, String color) {}
