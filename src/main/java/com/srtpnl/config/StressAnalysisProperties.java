package com.srtpnl.config;

import com.srtpnl.domain.model.ScenarioInput;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Default stress scenario set and run options.
 *
 * <p>Properties prefix: {@code srt.analysis.*}.
 * <ul>
 *   <li>{@code scenarios[i].stress-multiplier / trigger-year}: scenario list, run in order</li>
 *   <li>{@code base-trigger-year}: trigger year used for the default PnL time series (4)</li>
 *   <li>{@code parallel-enabled}: run scenarios on the scenario worker pool (false)</li>
 *   <li>{@code max-total-periods}: longest accepted horizon, maturity x periods per year (1200)</li>
 *   <li>{@code executor.*}: sizing of that pool</li>
 * </ul>
 */
@Data
@Component
@ConfigurationProperties(prefix = "srt.analysis")
public class StressAnalysisProperties {

    public static final int DEFAULT_MAX_TOTAL_PERIODS = 1200;

    private List<Scenario> scenarios = new ArrayList<>();
    private int baseTriggerYear = 4;
    private boolean parallelEnabled = false;
    private int maxTotalPeriods = DEFAULT_MAX_TOTAL_PERIODS;
    private Executor executor = new Executor();

    public List<ScenarioInput> toScenarioInputs() {
        return scenarios.stream()
                .map(s -> ScenarioInput.of(s.getStressMultiplier(), s.getTriggerYear()))
                .toList();
    }

    @Data
    public static class Scenario {
        private double stressMultiplier;
        private int triggerYear;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 2;
        private int maxPoolSize = 4;
        private int queueCapacity = 100;
    }
}
