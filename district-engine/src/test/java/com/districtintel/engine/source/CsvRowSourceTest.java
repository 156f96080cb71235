package com.districtintel.engine.source;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.service.RawRecordMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CsvRowSource Unit Tests")
class CsvRowSourceTest {

    @TempDir
    Path tempDir;

    private DistrictEngineProperties properties;
    private CsvRowSource source;

    @BeforeEach
    void setUp() {
        properties = new DistrictEngineProperties();
        source = new CsvRowSource(properties, new RawRecordMapper(properties));
    }

    private void givenCsv(String content) throws IOException {
        Path file = tempDir.resolve("districts.csv");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        properties.getSource().setCsvPath(file.toString());
    }

    @Test
    @DisplayName("Reads rows by header name, skipping blank lines and keeping short rows")
    void readsRows() throws IOException {
        givenCsv("""
                month,district_code,district_name,state_name,Total_Individuals_Worked,percentage_payments_gererated_within_15_days
                2024-06,0901,Agra,UTTAR PRADESH,145000,85

                2024-06,0902,"Aligarh, North",UTTAR PRADESH,abc
                """);

        List<RawRecord> rows = source.fetchRows();

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).getDistrictId()).isEqualTo("0901");
        assertThat(rows.get(0).getPeriod()).isEqualTo("2024-06");
        assertThat(rows.get(0).getPaymentSpeedPct()).isEqualTo("85");
        assertThat(rows.get(1).getDistrictName()).isEqualTo("Aligarh, North");
        assertThat(rows.get(1).getEmployedCount()).isEqualTo("abc");
        assertThat(rows.get(1).getPaymentSpeedPct()).isNull();
    }

    @Test
    @DisplayName("Empty file yields no rows")
    void emptyFile() throws IOException {
        givenCsv("");

        assertThat(source.fetchRows()).isEmpty();
    }

    @Test
    @DisplayName("Missing file surfaces as SourceUnavailableException")
    void missingFile() {
        properties.getSource().setCsvPath(tempDir.resolve("absent.csv").toString());

        assertThatThrownBy(() -> source.fetchRows())
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("absent.csv");
    }
}
