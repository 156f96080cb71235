package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.config.DistrictEngineProperties.Source.SourceMode;
import com.districtintel.engine.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Routes row fetches to the source selected by {@code district-engine.source.mode}.
 * Any failure of the source surfaces as {@link SourceUnavailableException}.
 */
@Component
@Slf4j
public class RowSourceRouter {

    private final Map<SourceMode, RowSource> sources = new EnumMap<>(SourceMode.class);
    private final DistrictEngineProperties properties;

    public RowSourceRouter(List<RowSource> sources, DistrictEngineProperties properties) {
        sources.forEach(s -> this.sources.put(s.mode(), s));
        this.properties = properties;
    }

    public SourceMode activeMode() {
        return properties.getSource().getMode();
    }

    public List<RawRecord> fetchRows() {
        SourceMode mode = activeMode();
        RowSource source = sources.get(mode);
        if (source == null) {
            throw new SourceUnavailableException("No row source registered for mode " + mode);
        }

        try {
            return source.fetchRows();
        } catch (SourceUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("{} source failed: {}", mode, e.getMessage());
            throw new SourceUnavailableException(mode + " source failed: " + e.getMessage(), e);
        }
    }
}
