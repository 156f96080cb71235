package com.districtintel.engine.analytics;

import java.util.List;

/**
 * Reference centroids for district grouping.
 *
 * The default centroids are hand-set guesses, not fitted to data. Provide another
 * policy bean to change them.
 */
public record ClusterPolicy(List<ClusterCentroid> centroids) {

    public ClusterPolicy {
        if (centroids.isEmpty()) {
            throw new IllegalArgumentException("At least one centroid is required");
        }
        centroids = List.copyOf(centroids);
    }

    public static ClusterPolicy defaults() {
        return new ClusterPolicy(List.of(
                new ClusterCentroid("High Performing", 150_000, 80),
                new ClusterCentroid("Medium Performing", 75_000, 50),
                new ClusterCentroid("Low Performing", 25_000, 20)));
    }
}
