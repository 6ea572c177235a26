package org.nowstart.rightside.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.engine.core.EntryTrigger;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.springframework.stereotype.Component;

/**
 * Scans forward from each capitulation cluster for one entry.
 *
 * <p>Phase 1 takes the lowest low of the {@code pivotSearchBars} bars starting at the capitulation
 * bar as the V-bottom. Phase 2 walks forward from the bar after that low; a lower low invalidates
 * the setup (stop hunt), otherwise the first bar matching {@link EntryType#V_TURN} or, failing that,
 * {@link EntryType#HIGHER_LOW} becomes the entry. Bars from the capitulation through the entry are
 * consumed and cannot seed another setup.
 */
@Component
public class EntryTriggerEngine {

    public List<EntryTrigger> scan(List<IndicatorBar> bars, boolean[] capitulationFlags, StrategyParams params) {
        if (bars == null || capitulationFlags == null || params == null) {
            throw new IllegalArgumentException("bars, capitulationFlags and params are required");
        }
        if (capitulationFlags.length != bars.size()) {
            throw new IllegalArgumentException("capitulationFlags length must match bars");
        }

        int n = bars.size();
        List<EntryTrigger> triggers = new ArrayList<>();
        // consumed ranges start past the previous one's end, so a single high-water mark covers them all
        int consumedThrough = -1;

        for (int capIndex = 0; capIndex < n; capIndex++) {
            if (!capitulationFlags[capIndex] || capIndex <= consumedThrough) {
                continue;
            }
            if (hourOf(bars.get(capIndex), params) >= params.entryCutoffHour()) {
                continue;
            }
            if (capIndex + params.pivotSearchBars() >= n) {
                continue;
            }

            int pivotIndex = lowestLowIndex(bars, capIndex, capIndex + params.pivotSearchBars());
            Optional<EntryTrigger> trigger = searchTrigger(bars, capIndex, pivotIndex, params);
            if (trigger.isPresent()) {
                triggers.add(trigger.get());
                consumedThrough = trigger.get().barIndex();
            }
        }
        return List.copyOf(triggers);
    }

    private Optional<EntryTrigger> searchTrigger(
            List<IndicatorBar> bars,
            int capIndex,
            int pivotIndex,
            StrategyParams params
    ) {
        double pivotPrice = bars.get(pivotIndex).low();
        int end = Math.min(bars.size(), pivotIndex + params.triggerSearchBars());

        for (int i = pivotIndex + 1; i < end; i++) {
            IndicatorBar current = bars.get(i);
            if (current.low() < pivotPrice) {
                return Optional.empty();
            }

            if (isVTurn(current, pivotPrice, params)) {
                return Optional.of(new EntryTrigger(
                        i,
                        capIndex,
                        pivotIndex,
                        current.timestamp(),
                        EntryType.V_TURN,
                        pivotPrice
                ));
            }

            int windowStart = Math.max(pivotIndex, i - params.higherLowLookback());
            double recentLow = Double.POSITIVE_INFINITY;
            double recentHigh = Double.NEGATIVE_INFINITY;
            for (int w = windowStart; w < i; w++) {
                recentLow = Math.min(recentLow, bars.get(w).low());
                recentHigh = Math.max(recentHigh, bars.get(w).high());
            }

            if (recentLow > pivotPrice * (1.0 + params.higherLowBuffer()) && current.close() > recentHigh) {
                return Optional.of(new EntryTrigger(
                        i,
                        capIndex,
                        pivotIndex,
                        current.timestamp(),
                        EntryType.HIGHER_LOW,
                        recentLow
                ));
            }
        }
        return Optional.empty();
    }

    private boolean isVTurn(IndicatorBar bar, double pivotPrice, StrategyParams params) {
        double distanceToStop = (bar.close() - pivotPrice) / bar.close();
        return bar.close() > bar.ema9()
                && bar.relativeVolume() > params.vTurnRelativeVolume()
                && bar.close() > bar.open()
                && distanceToStop < params.vTurnMaxStopDistance();
    }

    private int lowestLowIndex(List<IndicatorBar> bars, int from, int toExclusive) {
        int lowestIndex = from;
        for (int i = from + 1; i < toExclusive; i++) {
            if (bars.get(i).low() < bars.get(lowestIndex).low()) {
                lowestIndex = i;
            }
        }
        return lowestIndex;
    }

    private int hourOf(IndicatorBar bar, StrategyParams params) {
        return bar.timestamp().atZone(params.zoneId()).getHour();
    }
}
