package com.srtpnl.analysis;

import com.srtpnl.config.SrtDealProperties;
import com.srtpnl.config.StressAnalysisProperties;
import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.PeriodRecord;
import com.srtpnl.domain.model.ScenarioInput;
import com.srtpnl.engine.ScenarioRunner;
import com.srtpnl.exception.InvalidConfigurationException;
import com.srtpnl.exception.SimulationException;
import com.srtpnl.observability.AnalysisMetricsService;
import com.srtpnl.validation.ConfigurationValidator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.IntStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs a {@link ScenarioRunner} for every stress scenario and assembles the result table.
 *
 * <p>Deal parameters are validated once up front; a bad deal fails the whole analysis.
 * Each scenario is validated and simulated independently: a scenario that fails is
 * reported as a {@link ScenarioFailure} carrying its identifier and the remaining
 * scenarios still complete.
 *
 * <p>Scenarios run sequentially by default. With {@code srt.analysis.parallel-enabled}
 * they run on the {@code scenarioExecutor} pool; outcomes are re-ordered by scenario
 * index before concatenation, so the result is identical to a sequential run.
 */
@Service
public class StressAnalysisOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StressAnalysisOrchestrator.class);

    private final ScenarioRunner scenarioRunner;
    private final ConfigurationValidator configurationValidator;
    private final AnalysisMetricsService analysisMetricsService;
    private final SrtDealProperties srtDealProperties;
    private final StressAnalysisProperties stressAnalysisProperties;
    private final Executor scenarioExecutor;

    public StressAnalysisOrchestrator(
            ScenarioRunner scenarioRunner,
            ConfigurationValidator configurationValidator,
            AnalysisMetricsService analysisMetricsService,
            SrtDealProperties srtDealProperties,
            StressAnalysisProperties stressAnalysisProperties,
            @Qualifier("scenarioExecutor") Executor scenarioExecutor) {
        this.scenarioRunner = scenarioRunner;
        this.configurationValidator = configurationValidator;
        this.analysisMetricsService = analysisMetricsService;
        this.srtDealProperties = srtDealProperties;
        this.stressAnalysisProperties = stressAnalysisProperties;
        this.scenarioExecutor = scenarioExecutor;
    }

    /**
     * Runs every scenario against the deal.
     *
     * @param dealParameters deal economics shared by all scenarios
     * @param scenarios      scenarios in report order
     * @return records in scenario-then-chronological order, plus any scenario failures
     * @throws InvalidConfigurationException if the deal parameters are invalid
     */
    public StressAnalysisResult analyse(DealParameters dealParameters, List<ScenarioInput> scenarios) {
        configurationValidator.validateDeal(dealParameters);

        boolean parallel = stressAnalysisProperties.isParallelEnabled() && scenarios.size() > 1;
        log.info(
                "Running stress analysis: {} scenarios x {} periods ({})",
                scenarios.size(),
                dealParameters.getTotalPeriods(),
                parallel ? "parallel" : "sequential");

        List<ScenarioOutcome> outcomes =
                parallel ? runParallel(dealParameters, scenarios) : runSequential(dealParameters, scenarios);

        List<PeriodRecord> records = new ArrayList<>();
        List<ScenarioFailure> failures = new ArrayList<>();
        outcomes.stream().sorted(Comparator.comparingInt(ScenarioOutcome::scenarioIndex)).forEach(outcome -> {
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
            } else {
                records.addAll(outcome.records());
            }
        });

        log.info(
                "Stress analysis finished: {} records, {} of {} scenarios failed",
                records.size(),
                failures.size(),
                scenarios.size());
        return new StressAnalysisResult(scenarios.size(), dealParameters.getTotalPeriods(), records, failures);
    }

    /** Runs the deal and scenario set configured under {@code srt.*}. */
    public StressAnalysisResult analyseDefault() {
        return analyse(srtDealProperties.toDealParameters(), stressAnalysisProperties.toScenarioInputs());
    }

    /**
     * Cumulative PnL per period for every scenario with the given trigger year, keyed by
     * stress multiplier. Holding trigger timing constant isolates the effect of the loss
     * stress. A later scenario with the same multiplier replaces an earlier one.
     *
     * @return the series, empty when no successful scenario has that trigger year
     */
    public PnlTimeSeries pnlTimeSeries(StressAnalysisResult result, int triggerYear) {
        Map<Double, List<Double>> series = new LinkedHashMap<>();
        Map<Integer, List<Double>> byScenario = new LinkedHashMap<>();
        Map<Integer, Double> stressByScenario = new LinkedHashMap<>();

        for (PeriodRecord record : result.getRecords()) {
            if (record.getTriggerYear() != triggerYear) {
                continue;
            }
            byScenario
                    .computeIfAbsent(record.getScenarioIndex(), k -> new ArrayList<>())
                    .add(record.getCumulativePnl());
            stressByScenario.putIfAbsent(record.getScenarioIndex(), record.getStressMultiplier());
        }
        byScenario.forEach((index, pnl) -> {
            List<Double> replaced = series.put(stressByScenario.get(index), pnl);
            if (replaced != null) {
                log.debug(
                        "Trigger year {} series: {} replaces an earlier scenario with stress {}",
                        triggerYear,
                        ScenarioRunner.scenarioId(index),
                        stressByScenario.get(index));
            }
        });

        return new PnlTimeSeries(triggerYear, result.getPeriodsPerScenario(), series);
    }

    /** Time series for the configured base trigger year. */
    public PnlTimeSeries pnlTimeSeries(StressAnalysisResult result) {
        return pnlTimeSeries(result, stressAnalysisProperties.getBaseTriggerYear());
    }

    private List<ScenarioOutcome> runSequential(DealParameters dealParameters, List<ScenarioInput> scenarios) {
        return IntStream.range(0, scenarios.size())
                .mapToObj(index -> runScenario(dealParameters, scenarios.get(index), index))
                .toList();
    }

    private List<ScenarioOutcome> runParallel(DealParameters dealParameters, List<ScenarioInput> scenarios) {
        List<CompletableFuture<ScenarioOutcome>> futures = IntStream.range(0, scenarios.size())
                .mapToObj(index -> CompletableFuture.supplyAsync(
                        () -> runScenario(dealParameters, scenarios.get(index), index), scenarioExecutor))
                .toList();
        try {
            return futures.stream().map(CompletableFuture::join).toList();
        } catch (CompletionException e) {
            throw new SimulationException("Parallel scenario evaluation failed: " + e.getCause(), e.getCause());
        }
    }

    private ScenarioOutcome runScenario(DealParameters dealParameters, ScenarioInput scenarioInput, int index) {
        String scenarioId = ScenarioRunner.scenarioId(index);
        try {
            configurationValidator.validateScenario(scenarioId, scenarioInput, dealParameters.getMaturity());
        } catch (InvalidConfigurationException e) {
            log.warn("Skipping {}: {}", scenarioId, e.getMessage());
            analysisMetricsService.recordScenarioFailed();
            ScenarioFailure failure = ScenarioFailure.builder()
                    .scenarioId(scenarioId)
                    .scenarioIndex(index)
                    .stressMultiplier(scenarioInput != null ? scenarioInput.getStressMultiplier() : null)
                    .triggerYear(scenarioInput != null ? scenarioInput.getTriggerYear() : null)
                    .errorCode(e.getErrorCode().getCode())
                    .message(e.getMessage())
                    .build();
            return new ScenarioOutcome(index, List.of(), failure);
        }

        long start = System.nanoTime();
        List<PeriodRecord> records = scenarioRunner.run(dealParameters, scenarioInput, index);
        analysisMetricsService.recordScenarioCompleted(System.nanoTime() - start);

        if (log.isDebugEnabled() && !records.isEmpty()) {
            log.debug(
                    "{} (stress {}, trigger year {}) completed: final PnL {}",
                    scenarioId,
                    scenarioInput.getStressMultiplier(),
                    scenarioInput.getTriggerYear(),
                    records.get(records.size() - 1).getCumulativePnl());
        }
        return new ScenarioOutcome(index, records, null);
    }

    private record ScenarioOutcome(int scenarioIndex, List<PeriodRecord> records, ScenarioFailure failure) {}
}
