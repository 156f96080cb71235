package com.districtintel.engine.analytics;

import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nearest-centroid assignment in (employment, payment speed) space.
 */
@RequiredArgsConstructor
public class DistrictClusterer {

    private final ClusterPolicy policy;

    /**
     * @return centroid index → district ids in input order; empty clusters are omitted
     */
    public Map<Integer, List<String>> cluster(List<ClusterPoint> points) {
        Map<Integer, List<String>> clusters = new TreeMap<>();
        for (ClusterPoint point : points) {
            clusters.computeIfAbsent(nearest(point), k -> new ArrayList<>()).add(point.districtId());
        }
        return clusters;
    }

    int nearest(ClusterPoint point) {
        List<ClusterCentroid> centroids = policy.centroids();
        double minDistance = Double.POSITIVE_INFINITY;
        int clusterId = 0;
        for (int i = 0; i < centroids.size(); i++) {
            ClusterCentroid c = centroids.get(i);
            double distance = Math.hypot(point.employment() - c.employment(),
                    point.paymentSpeed() - c.paymentSpeed());
            // strict comparison keeps the first centroid on ties
            if (distance < minDistance) {
                minDistance = distance;
                clusterId = i;
            }
        }
        return clusterId;
    }

    public ClusterPolicy policy() {
        return policy;
    }
}
