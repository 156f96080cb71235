package com.districtintel.engine.analytics;

import java.util.List;
import java.util.Map;

/**
 * @param clusters      centroid index → district ids, empty when clustering is off
 * @param clusterLabels centroid index → centroid label
 */
public record ClusterReport(Map<Integer, List<String>> clusters,
                            String method,
                            int k,
                            Map<Integer, String> clusterLabels) {}
