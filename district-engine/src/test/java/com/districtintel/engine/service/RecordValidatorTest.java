package com.districtintel.engine.service;

import com.districtintel.engine.model.RawRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.event.Level;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("RecordValidator Unit Tests")
class RecordValidatorTest {

    private final List<String> events = new ArrayList<>();
    private final RecordValidator validator = new RecordValidator((ts, level, msg) -> events.add(level + " " + msg));

    private static RawRecord.RawRecordBuilder complete() {
        return RawRecord.builder()
                .districtId("UP-01")
                .districtName("Agra")
                .stateName("UTTAR PRADESH")
                .period("2024-06")
                .employedCount("145000")
                .paymentSpeedPct("85");
    }

    @ParameterizedTest(name = "districtId \"{0}\" is rejected")
    @NullAndEmptySource
    @ValueSource(strings = {"   "})
    void rejectsMissingDistrictId(String districtId) {
        QualityTally tally = new QualityTally();

        ValidationResult result = validator.validate(complete().districtId(districtId).build(), tally);

        assertThat(result.accepted()).isFalse();
        assertThat(result.rejectionReason()).isEqualTo(RejectionReason.MISSING_DISTRICT_ID);
        assertThat(events).singleElement().asString().startsWith(Level.ERROR + " Invalid districtId");

        assertThat(tally.toMetrics(0))
                .extracting("totalRows", "validRows", "invalidRows", "skippedDistricts")
                .containsExactly(1L, 0L, 1L, 1L);
    }

    @Test
    @DisplayName("Complete row is accepted without warnings")
    void acceptsCompleteRow() {
        QualityTally tally = new QualityTally();

        ValidationResult result = validator.validate(complete().build(), tally);

        assertThat(result.accepted()).isTrue();
        assertThat(result.warnings()).isEmpty();
        assertThat(events).isEmpty();
        assertThat(tally.toMetrics(1).getCompletenessScore()).isEqualTo(100.0);
        assertThat(tally.toMetrics(1).getFieldCompletenessScore()).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Degraded fields are kept with warnings")
    void warnsOnDegradedFields() {
        QualityTally tally = new QualityTally();

        ValidationResult result = validator.validate(complete()
                .districtName("")
                .employedCount("n/a")
                .paymentSpeedPct(null)
                .build(), tally);

        assertThat(result.accepted()).isTrue();
        assertThat(result.warnings()).hasSize(3);
        assertThat(result.warnings().get(1)).contains("employedCount", "n/a", "default: 0");
        assertThat(events).hasSize(3).allMatch(e -> e.startsWith(Level.WARN.toString()));

        assertThat(tally.toMetrics(1).getValidRows()).isEqualTo(1);
        assertThat(tally.toMetrics(1).getWarningCount()).isEqualTo(3);
        assertThat(tally.toMetrics(1).getFieldCompletenessScore()).isEqualTo(25.0);
    }

    @ParameterizedTest(name = "\"{0}\" is numeric")
    @ValueSource(strings = {"42", " 42 ", "-3.5", "1e5", "0"})
    void validNumerics(String raw) {
        assertThat(RecordValidator.isValidNumeric(raw)).isTrue();
    }

    @ParameterizedTest(name = "\"{0}\" is not numeric")
    @ValueSource(strings = {"", "abc", "12abc", "NaN", "Infinity", "12d", "0x1A", "1e999"})
    void invalidNumerics(String raw) {
        assertThat(RecordValidator.isValidNumeric(raw)).isFalse();
    }

    @Test
    @DisplayName("parseNumericSafe substitutes the default and names it in the warning")
    void parseNumericSafe() {
        assertThat(validator.parseNumericSafe("paymentSpeedPct", "72.5", 0)).isEqualTo(72.5);
        assertThat(events).isEmpty();

        assertThat(validator.parseNumericSafe("paymentSpeedPct", "--", -1)).isEqualTo(-1);
        assertThat(events).containsExactly(
                Level.WARN + " Invalid numeric value for paymentSpeedPct: --, using default: -1.0");
    }
}
