package com.srtpnl.analysis;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;
import lombok.Getter;

/**
 * Cumulative PnL trajectories of every scenario sharing one trigger year, aligned on a
 * common period axis {@code 1..periods}. Keyed by stress multiplier in scenario order.
 */
@Getter
public class PnlTimeSeries {

    private final int triggerYear;
    private final List<Integer> periods;
    private final Map<Double, List<Double>> cumulativePnlByStress;

    public PnlTimeSeries(int triggerYear, int periodCount, Map<Double, List<Double>> cumulativePnlByStress) {
        this.triggerYear = triggerYear;
        this.periods = IntStream.rangeClosed(1, periodCount).boxed().toList();
        Map<Double, List<Double>> copy = new LinkedHashMap<>();
        cumulativePnlByStress.forEach((stress, series) -> copy.put(stress, List.copyOf(series)));
        this.cumulativePnlByStress = Collections.unmodifiableMap(copy);
    }

    public boolean isEmpty() {
        return cumulativePnlByStress.isEmpty();
    }
}
