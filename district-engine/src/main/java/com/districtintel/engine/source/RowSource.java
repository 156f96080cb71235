package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties.Source.SourceMode;
import com.districtintel.engine.model.RawRecord;

import java.util.List;

/**
 * Delivers a full snapshot of raw rows. Implementations do their own I/O; the
 * engine only sees the mapped records.
 */
public interface RowSource {

    SourceMode mode();

    List<RawRecord> fetchRows();
}
