package com.srtpnl.validation;

import com.srtpnl.config.StressAnalysisProperties;
import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.ScenarioInput;
import com.srtpnl.exception.InvalidConfigurationException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Structural checks on deal parameters and stress scenarios, run before any simulation.
 *
 * <p>All violations are collected so the caller sees the complete picture, then raised
 * together as one {@link InvalidConfigurationException}. Risk-free rates must be
 * present and finite; other economic values (prices, sizes, loss rates) are not
 * range-checked, and over-stressed deals simply produce degenerate results. The horizon
 * is capped at {@code srt.analysis.max-total-periods}.
 */
@Component
public class ConfigurationValidator {

    private final int maxTotalPeriods;

    public ConfigurationValidator() {
        this(StressAnalysisProperties.DEFAULT_MAX_TOTAL_PERIODS);
    }

    public ConfigurationValidator(int maxTotalPeriods) {
        this.maxTotalPeriods = maxTotalPeriods;
    }

    @Autowired
    public ConfigurationValidator(StressAnalysisProperties stressAnalysisProperties) {
        this(stressAnalysisProperties.getMaxTotalPeriods());
    }

    public void validateDeal(DealParameters dealParameters) {
        List<ConfigurationViolation> violations = new ArrayList<>();

        if (dealParameters.getPeriodsPerYear() <= 0) {
            violations.add(ConfigurationViolation.of(
                    "periodsPerYear", "must be greater than 0", dealParameters.getPeriodsPerYear()));
        }
        if (dealParameters.getMaturity() <= 0) {
            violations.add(
                    ConfigurationViolation.of("maturity", "must be greater than 0", dealParameters.getMaturity()));
        }
        if (dealParameters.getPeriodsPerYear() > 0 && dealParameters.getMaturity() > 0) {
            long totalPeriods = (long) dealParameters.getMaturity() * dealParameters.getPeriodsPerYear();
            if (totalPeriods > maxTotalPeriods) {
                violations.add(ConfigurationViolation.of(
                        "maturity",
                        "times periodsPerYear must not exceed " + maxTotalPeriods + " periods",
                        totalPeriods));
            }
        }
        List<Double> riskFreeRates = dealParameters.getRiskFreeRates();
        if (riskFreeRates.isEmpty()) {
            violations.add(ConfigurationViolation.of("riskFreeRates", "must contain at least one rate", riskFreeRates));
        }
        for (int i = 0; i < riskFreeRates.size(); i++) {
            Double rate = riskFreeRates.get(i);
            if (rate == null || !Double.isFinite(rate)) {
                violations.add(ConfigurationViolation.of("riskFreeRates[" + i + "]", "must be a finite rate", rate));
            }
        }
        if (dealParameters.getReplenishmentPeriod() < 0) {
            violations.add(ConfigurationViolation.of(
                    "replenishmentPeriod", "must not be negative", dealParameters.getReplenishmentPeriod()));
        } else if (dealParameters.getReplenishmentPeriod() >= dealParameters.getMaturity()) {
            violations.add(ConfigurationViolation.of(
                    "replenishmentPeriod",
                    "must be less than maturity " + dealParameters.getMaturity(),
                    dealParameters.getReplenishmentPeriod()));
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException("deal parameters", violations);
        }
    }

    /**
     * Checks one scenario against the deal it will run on.
     *
     * @param scenarioId     label used in the error message
     * @param scenarioInput  the scenario
     * @param maturity       deal maturity in years
     */
    public void validateScenario(String scenarioId, ScenarioInput scenarioInput, int maturity) {
        if (scenarioInput == null) {
            throw new InvalidConfigurationException(
                    "scenario " + scenarioId, List.of(ConfigurationViolation.of("scenario", "must not be null", null)));
        }
        List<ConfigurationViolation> violations = new ArrayList<>();

        double stressMultiplier = scenarioInput.getStressMultiplier();
        if (!(stressMultiplier > 0) || Double.isInfinite(stressMultiplier)) {
            violations.add(ConfigurationViolation.of(
                    "stressMultiplier", "must be a positive finite number", stressMultiplier));
        }
        int triggerYear = scenarioInput.getTriggerYear();
        if (triggerYear < 1 || triggerYear > maturity) {
            violations.add(ConfigurationViolation.of(
                    "triggerYear", "must be between 1 and " + maturity, triggerYear));
        }

        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException("scenario " + scenarioId, violations);
        }
    }
}
