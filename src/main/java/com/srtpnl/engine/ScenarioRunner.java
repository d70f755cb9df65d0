package com.srtpnl.engine;

import com.srtpnl.domain.model.DealParameters;
import com.srtpnl.domain.model.PeriodRecord;
import com.srtpnl.domain.model.ScenarioInput;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.springframework.stereotype.Component;

/**
 * Drives the {@link WaterfallEngine} through every period of one scenario.
 *
 * <p>Each call starts from a fresh {@link SimulationState} and {@link DiscountingAccumulator},
 * so running the same scenario twice yields identical records. The runner itself holds
 * no per-scenario state.
 */
@Component
public class ScenarioRunner {

    private final WaterfallEngine waterfallEngine;

    public ScenarioRunner(WaterfallEngine waterfallEngine) {
        this.waterfallEngine = waterfallEngine;
    }

    /** Starts a lazy run; records are computed as the iterator is advanced. */
    public ScenarioRun start(DealParameters dealParameters, ScenarioInput scenarioInput, int scenarioIndex) {
        return new ScenarioRun(dealParameters, scenarioInput, scenarioIndex, waterfallEngine);
    }

    /** Ordered, sequential stream over a fresh run. Consumable once. */
    public Stream<PeriodRecord> stream(DealParameters dealParameters, ScenarioInput scenarioInput, int scenarioIndex) {
        ScenarioRun run = start(dealParameters, scenarioInput, scenarioIndex);
        Spliterator<PeriodRecord> spliterator = Spliterators.spliterator(
                run, dealParameters.getTotalPeriods(), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false);
    }

    /** Runs every period eagerly. */
    public List<PeriodRecord> run(DealParameters dealParameters, ScenarioInput scenarioInput, int scenarioIndex) {
        return stream(dealParameters, scenarioInput, scenarioIndex).toList();
    }

    /** Ledger label for the scenario at a 0-based index: "Stress 1", "Stress 2", ... */
    public static String scenarioId(int scenarioIndex) {
        return "Stress " + (scenarioIndex + 1);
    }
}
