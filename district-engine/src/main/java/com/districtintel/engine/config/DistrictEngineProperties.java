package com.districtintel.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "district-engine")
@Data
public class DistrictEngineProperties {

    private Source source = new Source();
    private Mappings mappings = new Mappings();
    private Rules rules = new Rules();
    private Ml ml = new Ml();
    private Quality quality = new Quality();
    private Scheduling scheduling = new Scheduling();
    private Listing listing = new Listing();

    @Data
    public static class Source {
        private SourceMode mode = SourceMode.CLOUD;
        private String csvPath = "/data/input/districts.csv";
        private String cloudApiUrl = "https://api.example.com/mgnrega-data";
        private String clickhouseTable = "district_intel.district_metrics";

        public enum SourceMode {
            CSV, CLOUD, CLICKHOUSE
        }
    }

    /**
     * Source column names for each RawRecord field.
     * The three value columns default to the same employment column, as the
     * upstream feed carries no separate figures for them.
     */
    @Data
    public static class Mappings {
        private String districtId = "district_code";
        private String districtName = "district_name";
        private String stateName = "state_name";
        private String period = "month";
        private String employedCount = "Total_Individuals_Worked";
        private String paymentSpeedPct = "percentage_payments_gererated_within_15_days";
        private String workAvailabilityValue = "Total_Individuals_Worked";
        private String stateComparisonValue = "Total_Individuals_Worked";
    }

    @Data
    public static class Rules {
        private double workAvailabilityHigh = 150_000;
        private double workAvailabilityMedium = 75_000;
        private double paymentSpeedGood = 80;
        private double paymentSpeedOkay = 50;
        private double stateComparisonCutoff = 100_000;
    }

    @Data
    public static class Ml {
        private boolean enabled = true;
        private boolean linearRegression = true;
        private boolean classification = true;
        private boolean timeSeriesForecasting = true;
        private boolean anomalyDetection = true;
        private boolean clustering = true;
    }

    @Data
    public static class Quality {
        private double alertThreshold = 80.0;
    }

    @Data
    public static class Scheduling {
        private String cron = "0 0 3 * * ?";
        private boolean runOnStartup = true;
    }

    @Data
    public static class Listing {
        private String defaultState = "UTTAR PRADESH";
    }
}
