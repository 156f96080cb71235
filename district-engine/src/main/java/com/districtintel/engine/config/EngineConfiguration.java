package com.districtintel.engine.config;

import com.districtintel.engine.analytics.AnalyticsEngine;
import com.districtintel.engine.analytics.ClusterPolicy;
import com.districtintel.engine.analytics.MlFeatureFlags;
import com.districtintel.engine.rules.RuleConfig;
import com.districtintel.engine.rules.RuleEngine;
import com.districtintel.engine.rules.StateComparisonPolicy;
import com.districtintel.engine.rules.ThresholdStateComparisonPolicy;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Builds the immutable engine configuration from {@link DistrictEngineProperties}.
 * Policies are separate beans so they can be replaced without touching the rules.
 */
@Configuration
public class EngineConfiguration {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder) {
        return builder
                .setConnectTimeout(Duration.ofSeconds(30))
                .setReadTimeout(Duration.ofMinutes(2))
                .build();
    }

    @Bean
    public StateComparisonPolicy stateComparisonPolicy(DistrictEngineProperties properties) {
        return ThresholdStateComparisonPolicy.withCutoff(properties.getRules().getStateComparisonCutoff());
    }

    @Bean
    public ClusterPolicy clusterPolicy() {
        return ClusterPolicy.defaults();
    }

    @Bean
    public RuleConfig ruleConfig(DistrictEngineProperties properties, StateComparisonPolicy stateComparisonPolicy) {
        DistrictEngineProperties.Rules r = properties.getRules();
        return RuleConfig.withThresholds(
                        r.getWorkAvailabilityHigh(), r.getWorkAvailabilityMedium(),
                        r.getPaymentSpeedGood(), r.getPaymentSpeedOkay(),
                        r.getStateComparisonCutoff())
                .toBuilder()
                .stateComparison(stateComparisonPolicy)
                .build();
    }

    @Bean
    public RuleEngine ruleEngine(RuleConfig ruleConfig) {
        return new RuleEngine(ruleConfig);
    }

    @Bean
    public MlFeatureFlags mlFeatureFlags(DistrictEngineProperties properties) {
        DistrictEngineProperties.Ml ml = properties.getMl();
        return MlFeatureFlags.builder()
                .enabled(ml.isEnabled())
                .linearRegression(ml.isLinearRegression())
                .classification(ml.isClassification())
                .timeSeriesForecasting(ml.isTimeSeriesForecasting())
                .anomalyDetection(ml.isAnomalyDetection())
                .clustering(ml.isClustering())
                .build();
    }

    @Bean
    public AnalyticsEngine analyticsEngine(MlFeatureFlags flags, RuleConfig ruleConfig, ClusterPolicy clusterPolicy) {
        // predicted payment categories reuse the payment speed tier labels
        return new AnalyticsEngine(flags, ruleConfig.getPaymentSpeed().labels(), clusterPolicy);
    }
}
