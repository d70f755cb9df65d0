package com.srtpnl.api.dto.response;

import com.srtpnl.analysis.PnlTimeSeries;
import com.srtpnl.analysis.ScenarioFailure;
import com.srtpnl.domain.model.PeriodRecord;
import com.srtpnl.reporting.ScenarioSummary;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class StressAnalysisResponse {

    private final int scenarioCount;
    private final int periodsPerScenario;
    private final List<PeriodRecord> records;
    private final List<ScenarioFailure> failures;
    private final List<ScenarioSummary> summaries;
    private final PnlTimeSeries pnlTimeSeries;
}
