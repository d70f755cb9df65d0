package com.srtpnl.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Service;

/**
 * Custom Micrometer metrics for stress analysis runs.
 * <ul>
 *   <li><b>srt.scenarios.completed</b> (counter): scenarios simulated to maturity</li>
 *   <li><b>srt.scenarios.failed</b> (counter): scenarios rejected by validation or failed</li>
 *   <li><b>srt.scenario.duration</b> (timer): wall time of one scenario run</li>
 * </ul>
 */
@Service
public class AnalysisMetricsService {

    private final Counter scenariosCompletedCounter;
    private final Counter scenariosFailedCounter;
    private final Timer scenarioDurationTimer;

    public AnalysisMetricsService(MeterRegistry meterRegistry) {
        this.scenariosCompletedCounter = Counter.builder("srt.scenarios.completed")
                .description("Scenarios simulated through to maturity")
                .register(meterRegistry);

        this.scenariosFailedCounter = Counter.builder("srt.scenarios.failed")
                .description("Scenarios rejected by validation or aborted")
                .register(meterRegistry);

        this.scenarioDurationTimer = Timer.builder("srt.scenario.duration")
                .description("Wall time of a single scenario simulation")
                .register(meterRegistry);
    }

    public void recordScenarioCompleted(long durationNanos) {
        scenariosCompletedCounter.increment();
        scenarioDurationTimer.record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void recordScenarioFailed() {
        scenariosFailedCounter.increment();
    }
}
