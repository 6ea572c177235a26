package org.nowstart.rightside.engine;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.springframework.stereotype.Component;

/**
 * Marks the structural pivot low among capitulation bars.
 *
 * <p>Positions are counted within the capitulation subsequence, not over absolute bars. The scan
 * stops at the first match, so at most one pivot is marked per run even when later clusters exist.
 */
@Component
public class PivotLocator {

    public boolean[] locate(List<IndicatorBar> bars, boolean[] capitulationFlags, StrategyParams params) {
        if (bars == null || capitulationFlags == null || params == null) {
            throw new IllegalArgumentException("bars, capitulationFlags and params are required");
        }
        if (capitulationFlags.length != bars.size()) {
            throw new IllegalArgumentException("capitulationFlags length must match bars");
        }

        boolean[] pivots = new boolean[bars.size()];
        List<Integer> capitulations = new ArrayList<>();
        for (int i = 0; i < capitulationFlags.length; i++) {
            if (capitulationFlags[i]) {
                capitulations.add(i);
            }
        }

        int count = capitulations.size();
        int halfWindow = params.pivotWindow();
        for (int i = 1; i < count; i++) {
            int windowStart = Math.max(0, i - halfWindow);
            int windowEnd = Math.min(count, i + halfWindow);

            double lowest = Double.POSITIVE_INFINITY;
            for (int w = windowStart; w < windowEnd; w++) {
                lowest = Math.min(lowest, bars.get(capitulations.get(w)).low());
            }

            int barIndex = capitulations.get(i);
            if (bars.get(barIndex).low() == lowest) {
                pivots[barIndex] = true;
                break;
            }
        }
        return pivots;
    }
}
