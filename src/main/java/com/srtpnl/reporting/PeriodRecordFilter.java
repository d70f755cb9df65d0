package com.srtpnl.reporting;

import com.srtpnl.domain.model.PeriodRecord;
import java.util.List;
import java.util.function.Predicate;
import lombok.Builder;
import lombok.Getter;

/**
 * Selects ledger rows by trigger year, stress multiplier and/or scenario.
 *
 * <p>Every criterion is optional; a null criterion matches everything. Stress
 * multipliers are compared exactly, as supplied in the scenario list.
 */
@Getter
@Builder
public class PeriodRecordFilter {

    private final Integer triggerYear;
    private final Double stressMultiplier;
    private final String scenarioId;

    public static PeriodRecordFilter all() {
        return PeriodRecordFilter.builder().build();
    }

    public boolean matches(PeriodRecord record) {
        return asPredicate().test(record);
    }

    public List<PeriodRecord> apply(List<PeriodRecord> records) {
        return records.stream().filter(asPredicate()).toList();
    }

    public List<LedgerRow> applyAsLedger(List<PeriodRecord> records) {
        return records.stream().filter(asPredicate()).map(LedgerRow::from).toList();
    }

    private Predicate<PeriodRecord> asPredicate() {
        Predicate<PeriodRecord> predicate = r -> true;
        if (triggerYear != null) {
            predicate = predicate.and(r -> r.getTriggerYear() == triggerYear);
        }
        if (stressMultiplier != null) {
            predicate = predicate.and(r -> Double.compare(r.getStressMultiplier(), stressMultiplier) == 0);
        }
        if (scenarioId != null) {
            predicate = predicate.and(r -> scenarioId.equals(r.getScenarioId()));
        }
        return predicate;
    }
}
