package com.districtintel.engine.service;

import com.districtintel.engine.config.DistrictEngineProperties;
import com.districtintel.engine.model.DistrictStore;
import com.districtintel.engine.model.QualityMetrics;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("QualityMonitor Unit Tests")
class QualityMonitorTest {

    private final DistrictStoreHolder holder = new DistrictStoreHolder();
    private final DistrictEngineProperties properties = new DistrictEngineProperties();
    private final QualityMonitor monitor = new QualityMonitor(holder, properties);

    private void publish(double completeness) {
        holder.publish(new StoreSnapshot(DistrictStore.empty(),
                QualityMetrics.builder().completenessScore(completeness).build()));
    }

    @Test
    @DisplayName("Summarizes the published cycle")
    void summarize() {
        publish(92.5);

        assertThat(monitor.summarize().getCompletenessScore()).isEqualTo(92.5);
    }

    @Test
    @DisplayName("Alerts strictly below the threshold")
    void alertThreshold() {
        publish(79.99);
        assertThat(monitor.shouldAlert()).isTrue();

        publish(80.0);
        assertThat(monitor.shouldAlert()).isFalse();
    }

    @Test
    @DisplayName("Threshold is configurable")
    void configurableThreshold() {
        properties.getQuality().setAlertThreshold(95);
        publish(90);

        assertThat(monitor.shouldAlert()).isTrue();
    }
}
