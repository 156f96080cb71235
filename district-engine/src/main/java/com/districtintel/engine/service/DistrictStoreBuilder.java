package com.districtintel.engine.service;

import com.districtintel.engine.model.DistrictEntry;
import com.districtintel.engine.model.DistrictStore;
import com.districtintel.engine.model.QualityMetrics;
import com.districtintel.engine.model.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reduces a full snapshot of raw rows to one {@link DistrictEntry} per district.
 *
 * Pure apart from quality logging: the same rows always produce an equal snapshot.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class DistrictStoreBuilder {

    /** Newest period first, rows without a period last. */
    static final Comparator<RawRecord> NEWEST_FIRST = Comparator.comparing(
            RawRecord::getPeriod, Comparator.nullsFirst(Comparator.<String>naturalOrder())).reversed();

    private final RecordValidator validator;

    public StoreSnapshot build(List<RawRecord> rows) {
        QualityTally tally = new QualityTally();
        Map<String, List<RawRecord>> byDistrict = new LinkedHashMap<>();

        for (RawRecord row : rows) {
            ValidationResult result = validator.validate(row, tally);
            if (!result.accepted()) continue;
            byDistrict.computeIfAbsent(row.getDistrictId(), k -> new ArrayList<>()).add(row);
        }

        Map<String, DistrictEntry> entries = new HashMap<>();
        byDistrict.forEach((districtId, group) -> entries.put(districtId, toEntry(districtId, group)));

        QualityMetrics metrics = tally.toMetrics(entries.size());
        log.info("Snapshot built: {} rows, {} valid, {} invalid, {} districts",
                metrics.getTotalRows(), metrics.getValidRows(), metrics.getInvalidRows(), entries.size());

        return new StoreSnapshot(new DistrictStore(entries), metrics);
    }

    DistrictEntry toEntry(String districtId, List<RawRecord> group) {
        List<RawRecord> sorted = new ArrayList<>(group);
        sorted.sort(NEWEST_FIRST);
        RawRecord latest = sorted.get(0);

        if (log.isDebugEnabled()) {
            log.debug("District {}: latest period={}, employed={}, paymentSpeed={}",
                    districtId, latest.getPeriod(), latest.getEmployedCount(), latest.getPaymentSpeedPct());
        }
        return new DistrictEntry(districtId, latest, history(sorted));
    }

    static List<Double> history(List<RawRecord> newestFirst) {
        List<Double> history = new ArrayList<>(DistrictEntry.HISTORY_LENGTH);
        for (RawRecord r : newestFirst.subList(0, Math.min(DistrictEntry.HISTORY_LENGTH, newestFirst.size()))) {
            history.add(RecordValidator.parseOrDefault(r.getEmployedCount(), 0));
        }
        double pad = history.isEmpty() ? 0 : history.get(0);
        while (history.size() < DistrictEntry.HISTORY_LENGTH) {
            history.add(pad);
        }
        return history;
    }
}
