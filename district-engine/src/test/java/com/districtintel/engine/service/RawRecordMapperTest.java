package com.districtintel.engine.service;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.model.RawRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RawRecordMapper Unit Tests")
class RawRecordMapperTest {

    private final DistrictEngineProperties properties = new DistrictEngineProperties();
    private final RawRecordMapper mapper = new RawRecordMapper(properties);

    @Test
    @DisplayName("Maps source columns and keeps numbers as text")
    void mapsDefaultColumns() {
        RawRecord record = mapper.map(Map.of(
                "district_code", "0901",
                "district_name", "Agra",
                "state_name", "UTTAR PRADESH",
                "month", "2024-06",
                "Total_Individuals_Worked", 145000,
                "percentage_payments_gererated_within_15_days", 85.5));

        assertThat(record.getDistrictId()).isEqualTo("0901");
        assertThat(record.getDistrictName()).isEqualTo("Agra");
        assertThat(record.getPeriod()).isEqualTo("2024-06");
        assertThat(record.getEmployedCount()).isEqualTo("145000");
        assertThat(record.getPaymentSpeedPct()).isEqualTo("85.5");
        assertThat(record.getWorkAvailabilityValue()).isEqualTo("145000");
        assertThat(record.getStateComparisonValue()).isEqualTo("145000");
    }

    @Test
    @DisplayName("Non-string district id is dropped so the row gets rejected")
    void nonStringDistrictId() {
        assertThat(mapper.map(Map.of("district_code", 901)).getDistrictId()).isNull();
    }

    @Test
    @DisplayName("Absent columns map to null")
    void absentColumns() {
        Map<String, Object> row = new HashMap<>();
        row.put("district_code", "0901");
        row.put("district_name", null);

        RawRecord record = mapper.map(row);

        assertThat(record.getDistrictName()).isNull();
        assertThat(record.getEmployedCount()).isNull();
    }

    @Test
    @DisplayName("Custom mappings are honoured")
    void customMappings() {
        properties.getMappings().setDistrictId("code");
        properties.getMappings().setEmployedCount("workers");

        RawRecord record = mapper.map(Map.of("code", "X1", "workers", "12"));

        assertThat(record.getDistrictId()).isEqualTo("X1");
        assertThat(record.getEmployedCount()).isEqualTo("12");
    }
}
