package com.districtintel.engine.model;

import lombok.Value;

import java.util.List;

/**
 * Latest record for one district plus its recent employment series.
 *
 * history always holds exactly {@link #HISTORY_LENGTH} values, most recent first.
 */
@Value
public class DistrictEntry {

    public static final int HISTORY_LENGTH = 6;

    String districtId;
    RawRecord latest;
    List<Double> history;

    public DistrictEntry(String districtId, RawRecord latest, List<Double> history) {
        if (history.size() != HISTORY_LENGTH) {
            throw new IllegalArgumentException(
                    "history must have " + HISTORY_LENGTH + " values, got " + history.size());
        }
        this.districtId = districtId;
        this.latest = latest;
        this.history = List.copyOf(history);
    }

    /** History reordered oldest to newest, the order the estimators read. */
    public double[] chronologicalHistory() {
        double[] out = new double[history.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = history.get(history.size() - 1 - i);
        }
        return out;
    }
}
