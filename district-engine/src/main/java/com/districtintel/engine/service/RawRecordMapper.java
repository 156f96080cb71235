package com.districtintel.engine.service;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.model.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Maps a source row, keyed by source column names, to a {@link RawRecord}.
 *
 * Column names come from {@code district-engine.mappings}. Values are kept as text;
 * the district id is kept only when the source delivered it as a string.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RawRecordMapper {

    private final DistrictEngineProperties properties;

    public RawRecord map(Map<String, ?> row) {
        DistrictEngineProperties.Mappings m = properties.getMappings();

        return RawRecord.builder()
                .districtId(stringOnly(row.get(m.getDistrictId())))
                .districtName(text(row.get(m.getDistrictName())))
                .stateName(text(row.get(m.getStateName())))
                .period(text(row.get(m.getPeriod())))
                .employedCount(text(row.get(m.getEmployedCount())))
                .paymentSpeedPct(text(row.get(m.getPaymentSpeedPct())))
                .workAvailabilityValue(text(row.get(m.getWorkAvailabilityValue())))
                .stateComparisonValue(text(row.get(m.getStateComparisonValue())))
                .build();
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private String stringOnly(Object val) {
        if (val == null || val instanceof String) return (String) val;
        log.debug("Ignoring non-string district id of type {}: {}", val.getClass().getSimpleName(), val);
        return null;
    }

    private String text(Object val) {
        return val == null ? null : val.toString();
    }
}
