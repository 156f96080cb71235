package com.districtintel.engine.service;

import com.districtintel.engine.analytics.AnalyticsEngine;
import com.districtintel.engine.analytics.AnomalyVerdict;
import com.districtintel.engine.analytics.CategoryPrediction;
import com.districtintel.engine.model.DisplayPayload;
import com.districtintel.engine.model.DistrictEntry;
import com.districtintel.engine.model.MlInsights;
import com.districtintel.engine.model.RawRecord;
import com.districtintel.engine.rules.Classification;
import com.districtintel.engine.rules.Metric;
import com.districtintel.engine.rules.RuleConfig;
import com.districtintel.engine.rules.RuleEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Derives the display payload for one district. Estimators run only to fill a
 * missing or zero raw value, apart from the forecast and the anomaly check which
 * always run.
 */
@Component
@RequiredArgsConstructor
public class DisplayPayloadAssembler {

    static final String ANOMALY_ALERT = "Unusual district performance detected";

    private final RuleEngine ruleEngine;
    private final AnalyticsEngine analytics;
    private final RecordValidator validator;

    public DisplayPayload assemble(DistrictEntry entry) {
        RawRecord raw = entry.getLatest();
        RuleConfig config = ruleEngine.config();

        // employedCount and paymentSpeedPct were already reported at ingestion
        double employed = RecordValidator.parseOrDefault(raw.getEmployedCount(), 0);
        double paymentSpeed = RecordValidator.parseOrDefault(raw.getPaymentSpeedPct(), 0);
        double workAvailability = validator.parseNumericSafe("workAvailabilityValue", raw.getWorkAvailabilityValue(), 0);
        double stateComparison = validator.parseNumericSafe("stateComparisonValue", raw.getStateComparisonValue(), 0);

        double[] chronological = entry.chronologicalHistory();

        OptionalDouble predictedEmployment = ruleEngine.hasData(employed)
                ? OptionalDouble.empty()
                : analytics.predictEmployment(chronological);
        double effectiveEmployment = ruleEngine.hasData(employed) ? employed : predictedEmployment.orElse(0);

        Optional<CategoryPrediction> predictedPaymentSpeed = ruleEngine.hasData(paymentSpeed)
                ? Optional.empty()
                : analytics.classifyPaymentSpeed(effectiveEmployment, chronological);

        OptionalDouble forecast = analytics.forecastEmployment(chronological);
        boolean anomaly = analytics.detectAnomaly(effectiveEmployment, chronological)
                .map(AnomalyVerdict::anomalous)
                .orElse(false);

        Classification work = ruleEngine.describe(Metric.WORK_AVAILABILITY, workAvailability);
        Classification payment = paymentClassification(paymentSpeed, predictedPaymentSpeed, config);
        Classification state = ruleEngine.describe(Metric.STATE_COMPARISON, stateComparison);

        return DisplayPayload.builder()
                .districtId(entry.getDistrictId())
                .districtName(RecordValidator.isValidString(raw.getDistrictName())
                        ? raw.getDistrictName() : entry.getDistrictId())
                .workAvailability(work.label())
                .workAvailabilityColor(work.color())
                .paymentSpeed(payment.label())
                .paymentSpeedColor(payment.color())
                .peopleEmployed(peopleEmployed(employed, predictedEmployment, config))
                .stateComparison(state.label())
                .stateComparisonColor(state.color())
                .historicalEmployed(entry.getHistory())
                .mlInsights(MlInsights.builder()
                        .predictedEmployment(boxed(predictedEmployment))
                        .predictedPaymentSpeed(predictedPaymentSpeed.map(CategoryPrediction::label).orElse(null))
                        .forecastedEmployment(boxed(forecast))
                        .anomaly(anomaly)
                        .anomalyAlert(anomaly ? ANOMALY_ALERT : null)
                        .build())
                .helpText(config.getHelpText())
                .build();
    }

    private Classification paymentClassification(double paymentSpeed,
                                                 Optional<CategoryPrediction> predicted,
                                                 RuleConfig config) {
        if (ruleEngine.hasData(paymentSpeed)) {
            return ruleEngine.classify(Metric.PAYMENT_SPEED, paymentSpeed);
        }
        return predicted
                .map(p -> new Classification(p.label(), config.getPredictedColor()))
                .orElse(config.getUnavailable());
    }

    private String peopleEmployed(double employed, OptionalDouble predicted, RuleConfig config) {
        if (ruleEngine.hasData(employed)) {
            return ruleEngine.format(Metric.PEOPLE_EMPLOYED, employed);
        }
        if (predicted.isPresent() && ruleEngine.hasData(predicted.getAsDouble())) {
            return ruleEngine.formatPredicted(Metric.PEOPLE_EMPLOYED, predicted.getAsDouble());
        }
        return config.getUnavailable().label();
    }

    private static Double boxed(OptionalDouble value) {
        return value.isPresent() ? value.getAsDouble() : null;
    }
}
