package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.service.RawRecordMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClickHouseRowSource Unit Tests")
class ClickHouseRowSourceTest {

    @Mock
    private JdbcTemplate jdbcTemplate;

    private ClickHouseRowSource source;

    @BeforeEach
    void setUp() {
        DistrictEngineProperties properties = new DistrictEngineProperties();
        properties.getSource().setClickhouseTable("district_intel.district_metrics");
        source = new ClickHouseRowSource(jdbcTemplate, properties, new RawRecordMapper(properties));
    }

    @Test
    @DisplayName("Should read the deduplicated table and map its columns")
    void shouldReadWithFinal() {
        // Given
        when(jdbcTemplate.queryForList("SELECT * FROM district_intel.district_metrics FINAL"))
                .thenReturn(List.of(Map.of(
                        "district_code", "0901",
                        "month", "2024-06",
                        "Total_Individuals_Worked", "145000")));

        // When
        List<RawRecord> rows = source.fetchRows();

        // Then
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0).getDistrictId()).isEqualTo("0901");
        assertThat(rows.get(0).getEmployedCount()).isEqualTo("145000");
    }
}
