package com.srtpnl.api.controller;

import com.srtpnl.analysis.PnlTimeSeries;
import com.srtpnl.analysis.StressAnalysisOrchestrator;
import com.srtpnl.analysis.StressAnalysisResult;
import com.srtpnl.api.dto.request.StressAnalysisRequest;
import com.srtpnl.api.dto.response.StressAnalysisResponse;
import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.ScenarioInput;
import com.srtpnl.mapper.AnalysisRequestMapper;
import com.srtpnl.reporting.LedgerRow;
import com.srtpnl.reporting.PeriodRecordFilter;
import com.srtpnl.reporting.ScenarioSummaryCalculator;
import jakarta.validation.Valid;
import java.util.List;
import org.mapstruct.factory.Mappers;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for SRT stress analysis.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/srt/analysis} -- run a caller-supplied deal and scenario set</li>
 *   <li>{@code GET /api/srt/analysis/default} -- run the configured deal and scenarios</li>
 *   <li>{@code GET /api/srt/analysis/default/pnl-series} -- cumulative PnL per quarter for one trigger year</li>
 *   <li>{@code GET /api/srt/analysis/default/ledger} -- filtered ledger rows</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/srt")
public class StressAnalysisController {

    private final StressAnalysisOrchestrator stressAnalysisOrchestrator;
    private final ScenarioSummaryCalculator scenarioSummaryCalculator;
    private final AnalysisRequestMapper analysisRequestMapper = Mappers.getMapper(AnalysisRequestMapper.class);

    public StressAnalysisController(
            StressAnalysisOrchestrator stressAnalysisOrchestrator,
            ScenarioSummaryCalculator scenarioSummaryCalculator) {
        this.stressAnalysisOrchestrator = stressAnalysisOrchestrator;
        this.scenarioSummaryCalculator = scenarioSummaryCalculator;
    }

    @PostMapping("/analysis")
    public StressAnalysisResponse runAnalysis(@Valid @RequestBody StressAnalysisRequest request) {
        DealParameters dealParameters = analysisRequestMapper.toDealParameters(request.getDeal());
        List<ScenarioInput> scenarios = analysisRequestMapper.toScenarioInputs(request.getScenarios());

        StressAnalysisResult result = stressAnalysisOrchestrator.analyse(dealParameters, scenarios);
        PnlTimeSeries series = request.getSeriesTriggerYear() != null
                ? stressAnalysisOrchestrator.pnlTimeSeries(result, request.getSeriesTriggerYear())
                : stressAnalysisOrchestrator.pnlTimeSeries(result);
        return toResponse(result, series);
    }

    @GetMapping("/analysis/default")
    public StressAnalysisResponse runDefaultAnalysis() {
        StressAnalysisResult result = stressAnalysisOrchestrator.analyseDefault();
        return toResponse(result, stressAnalysisOrchestrator.pnlTimeSeries(result));
    }

    @GetMapping("/analysis/default/pnl-series")
    public PnlTimeSeries getDefaultPnlSeries(@RequestParam(required = false) Integer triggerYear) {
        StressAnalysisResult result = stressAnalysisOrchestrator.analyseDefault();
        return triggerYear != null
                ? stressAnalysisOrchestrator.pnlTimeSeries(result, triggerYear)
                : stressAnalysisOrchestrator.pnlTimeSeries(result);
    }

    @GetMapping("/analysis/default/ledger")
    public List<LedgerRow> getDefaultLedger(
            @RequestParam(required = false) Integer triggerYear,
            @RequestParam(required = false) Double stressMultiplier,
            @RequestParam(required = false) String scenarioId) {
        StressAnalysisResult result = stressAnalysisOrchestrator.analyseDefault();
        PeriodRecordFilter filter = PeriodRecordFilter.builder()
                .triggerYear(triggerYear)
                .stressMultiplier(stressMultiplier)
                .scenarioId(scenarioId)
                .build();
        return filter.applyAsLedger(result.getRecords());
    }

    private StressAnalysisResponse toResponse(StressAnalysisResult result, PnlTimeSeries series) {
        return StressAnalysisResponse.builder()
                .scenarioCount(result.getScenarioCount())
                .periodsPerScenario(result.getPeriodsPerScenario())
                .records(result.getRecords())
                .failures(result.getFailures())
                .summaries(scenarioSummaryCalculator.summarise(result))
                .pnlTimeSeries(series)
                .build();
    }
}
