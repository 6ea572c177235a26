package org.nowstart.rightside.engine;

import java.util.List;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.springframework.stereotype.Component;

@Component
public class CapitulationDetector {

    public boolean[] detect(List<IndicatorBar> bars, StrategyParams params) {
        if (bars == null || params == null) {
            throw new IllegalArgumentException("bars and params are required");
        }
        boolean[] flags = new boolean[bars.size()];
        for (int i = 0; i < bars.size(); i++) {
            flags[i] = isCapitulation(bars.get(i), params);
        }
        return flags;
    }

    public boolean isCapitulation(IndicatorBar bar, StrategyParams params) {
        // NaN fails every comparison, so bars without enough history never qualify
        return bar.relativeVolume() > params.rvolThreshold()
                && bar.vwapDistancePct() < -params.vwapDistanceThreshold()
                && bar.dropAtr() > params.atrDropMultiplier()
                && bar.rsi() < params.rsiThreshold();
    }

    public static int count(boolean[] flags) {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        return count;
    }
}
