package com.srtpnl.analysis;

import com.srtpnl.domain.model.PeriodRecord;
import java.util.List;
import lombok.Getter;

/**
 * The result table of one stress analysis: every emitted {@link PeriodRecord}, ordered by
 * scenario then chronologically, plus the scenarios that failed.
 *
 * <p>Read-only: both lists are unmodifiable copies.
 */
@Getter
public class StressAnalysisResult {

    private final int scenarioCount;
    private final int periodsPerScenario;
    private final List<PeriodRecord> records;
    private final List<ScenarioFailure> failures;

    public StressAnalysisResult(
            int scenarioCount, int periodsPerScenario, List<PeriodRecord> records, List<ScenarioFailure> failures) {
        this.scenarioCount = scenarioCount;
        this.periodsPerScenario = periodsPerScenario;
        this.records = List.copyOf(records);
        this.failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /** Records of a single scenario, in chronological order. */
    public List<PeriodRecord> recordsFor(String scenarioId) {
        return records.stream()
                .filter(r -> r.getScenarioId().equals(scenarioId))
                .toList();
    }
}
