package com.srtpnl.reporting;

import com.srtpnl.analysis.StressAnalysisResult;
import com.srtpnl.domain.enums.AmortisationRegime;
import com.srtpnl.domain.model.PeriodRecord;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Condenses each scenario's ledger into a {@link ScenarioSummary}.
 *
 * <p>Surfaces the degenerate outcomes the engine leaves unclamped: the
 * first period in which tranche exposure went negative marks the tranche as wiped out.
 */
@Component
public class ScenarioSummaryCalculator {

    private static final Logger log = LoggerFactory.getLogger(ScenarioSummaryCalculator.class);

    public List<ScenarioSummary> summarise(StressAnalysisResult result) {
        Map<String, List<PeriodRecord>> byScenario = new LinkedHashMap<>();
        for (PeriodRecord record : result.getRecords()) {
            byScenario.computeIfAbsent(record.getScenarioId(), k -> new ArrayList<>()).add(record);
        }
        return byScenario.values().stream().map(this::summarise).toList();
    }

    /**
     * Summarises one scenario's records.
     *
     * @param records a single scenario's records in chronological order, non-empty
     */
    public ScenarioSummary summarise(List<PeriodRecord> records) {
        PeriodRecord first = records.get(0);
        PeriodRecord last = records.get(records.size() - 1);

        double totalLosses = 0;
        double totalPrincipal = 0;
        double totalCoupon = 0;
        double minimumExposure = Double.POSITIVE_INFINITY;
        Integer firstSequentialPeriod = null;
        Integer firstWipedOutPeriod = null;

        for (PeriodRecord record : records) {
            totalLosses += record.getPeriodLosses();
            totalPrincipal += record.getPrincipalPayment();
            totalCoupon += record.getQuarterlyCoupon();
            minimumExposure = Math.min(minimumExposure, record.getTrancheExposure());
            if (firstSequentialPeriod == null && record.getAmortisationRegime() == AmortisationRegime.SEQUENTIAL) {
                firstSequentialPeriod = record.getPeriod();
            }
            if (firstWipedOutPeriod == null && record.isTrancheWipedOut()) {
                firstWipedOutPeriod = record.getPeriod();
            }
        }

        if (firstWipedOutPeriod != null) {
            log.warn(
                    "{} (stress {}) wiped out the tranche in period {}",
                    first.getScenarioId(),
                    first.getStressMultiplier(),
                    firstWipedOutPeriod);
        }

        return ScenarioSummary.builder()
                .scenarioId(first.getScenarioId())
                .stressMultiplier(first.getStressMultiplier())
                .triggerYear(first.getTriggerYear())
                .periods(records.size())
                .finalCumulativePnl(last.getCumulativePnl())
                .finalRiskAdjustedPnl(last.getRiskAdjustedPnl())
                .totalLosses(totalLosses)
                .totalPrincipalReceived(totalPrincipal)
                .totalCouponReceived(totalCoupon)
                .minimumTrancheExposure(minimumExposure)
                .finalRemainingNotional(last.getRemainingNotional())
                .firstSequentialPeriod(firstSequentialPeriod)
                .trancheWipedOut(firstWipedOutPeriod != null)
                .firstWipedOutPeriod(firstWipedOutPeriod)
                .build();
    }
}
