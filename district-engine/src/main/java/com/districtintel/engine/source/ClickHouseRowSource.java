package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.config.DistrictEngineProperties.Source.SourceMode;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.service.RawRecordMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Reads raw district rows from a ClickHouse table whose column names follow
 * {@code district-engine.mappings}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseRowSource implements RowSource {

    private final JdbcTemplate jdbcTemplate;
    private final DistrictEngineProperties properties;
    private final RawRecordMapper mapper;

    @Override
    public SourceMode mode() {
        return SourceMode.CLICKHOUSE;
    }

    public void ensureSchema() {
        String table = properties.getSource().getClickhouseTable();
        DistrictEngineProperties.Mappings m = properties.getMappings();
        log.info("Ensuring ClickHouse table {} exists...", table);

        jdbcTemplate.execute(String.format("""
            CREATE TABLE IF NOT EXISTS %s
            (
                `%s`    String,
                `%s`    Nullable(String),
                `%s`    LowCardinality(Nullable(String)),
                `%s`    String,
                `%s`    Nullable(String),
                `%s`    Nullable(String)
            )
            ENGINE = ReplacingMergeTree()
            ORDER BY (`%s`, `%s`)
            """,
                table,
                m.getDistrictId(), m.getDistrictName(), m.getStateName(), m.getPeriod(),
                m.getEmployedCount(), m.getPaymentSpeedPct(),
                m.getDistrictId(), m.getPeriod()));

        log.info("ClickHouse table ready.");
    }

    @Override
    public List<RawRecord> fetchRows() {
        String table = properties.getSource().getClickhouseTable();
        log.info("Reading district rows from ClickHouse table {}", table);

        // FINAL collapses (district, period) duplicates the ReplacingMergeTree has not merged yet
        List<Map<String, Object>> rows = jdbcTemplate.queryForList("SELECT * FROM " + table + " FINAL");
        log.info("ClickHouse returned {} rows", rows.size());

        return rows.stream().map(mapper::map).toList();
    }
}
