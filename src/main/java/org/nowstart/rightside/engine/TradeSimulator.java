package org.nowstart.rightside.engine;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.data.type.ExitReason;
import org.nowstart.rightside.data.type.TradeStatus;
import org.nowstart.rightside.engine.core.EntryTrigger;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.nowstart.rightside.engine.core.Trade;
import org.springframework.stereotype.Component;

/**
 * Replays every entry trigger bar by bar.
 *
 * <p>Entry is the trigger bar's close. On each following bar, in order: a new calendar day closes at
 * that bar's open; a low under the previous bar's low closes at {@code min(open, previous low)}; a bar
 * at or after the exit hour closes at its close. A trade still open when the look-ahead slice runs out
 * closes at the last slice bar's close. Trades are independent of each other and may overlap.
 */
@Component
public class TradeSimulator {

    public List<Trade> simulate(List<IndicatorBar> bars, List<EntryTrigger> triggers, StrategyParams params) {
        if (bars == null || triggers == null || params == null) {
            throw new IllegalArgumentException("bars, triggers and params are required");
        }

        List<EntryTrigger> ordered = new ArrayList<>(triggers);
        ordered.sort(Comparator.comparingInt(EntryTrigger::barIndex));

        List<Trade> trades = new ArrayList<>(ordered.size());
        for (EntryTrigger trigger : ordered) {
            trades.add(simulateTrade(bars, trigger, params));
        }
        return List.copyOf(trades);
    }

    public Trade simulateTrade(List<IndicatorBar> bars, EntryTrigger trigger, StrategyParams params) {
        int entryIndex = trigger.barIndex();
        if (entryIndex < 0 || entryIndex >= bars.size()) {
            throw new IllegalArgumentException("trigger barIndex out of range: " + entryIndex);
        }

        IndicatorBar entryBar = bars.get(entryIndex);
        OpenTrade trade = new OpenTrade(entryBar, trigger, params);
        LocalDate entryDate = dateOf(entryBar, params);
        int sliceEnd = Math.min(bars.size(), entryIndex + params.maxHoldBars());

        for (int i = entryIndex + 1; i < sliceEnd; i++) {
            IndicatorBar bar = bars.get(i);
            if (!dateOf(bar, params).equals(entryDate)) {
                return trade.close(bar, bar.open(), ExitReason.NEXT_DAY_FORCE_CLOSE);
            }

            trade.barsHeld++;
            trade.trailingStop = bars.get(i - 1).low();
            if (bar.low() < trade.trailingStop) {
                return trade.close(bar, Math.min(bar.open(), trade.trailingStop), ExitReason.PREV_CANDLE_LOW);
            }

            if (hourOf(bar, params) >= params.exitHour()) {
                return trade.close(bar, bar.close(), ExitReason.EOD_1500);
            }
        }

        IndicatorBar last = bars.get(sliceEnd - 1);
        return trade.close(last, last.close(), ExitReason.END_OF_SLICE);
    }

    private LocalDate dateOf(IndicatorBar bar, StrategyParams params) {
        return bar.timestamp().atZone(params.zoneId()).toLocalDate();
    }

    private int hourOf(IndicatorBar bar, StrategyParams params) {
        return bar.timestamp().atZone(params.zoneId()).getHour();
    }

    private static final class OpenTrade {

        private final IndicatorBar entryBar;
        private final double entryPrice;
        private final double initialStop;
        private final double entryRisk;
        private final EntryType entryType;
        private double trailingStop;
        private int barsHeld;

        private OpenTrade(IndicatorBar entryBar, EntryTrigger trigger, StrategyParams params) {
            this.entryBar = entryBar;
            this.entryPrice = entryBar.close();
            this.entryType = trigger.entryType();
            this.initialStop = Double.isFinite(trigger.stopLossPrice())
                    ? trigger.stopLossPrice()
                    : entryPrice * (1.0 - params.fallbackStopPct());
            double risk = entryPrice - initialStop;
            // informational only; never gates the entry
            this.entryRisk = risk > 0.0 ? risk : entryPrice * params.minRiskPct();
            this.trailingStop = initialStop;
        }

        private Trade close(IndicatorBar exitBar, double exitPrice, ExitReason reason) {
            return new Trade(
                    entryBar.timestamp(),
                    entryPrice,
                    initialStop,
                    entryType,
                    entryRisk,
                    exitBar.timestamp(),
                    exitPrice,
                    TradeStatus.CLOSED,
                    Trade.pnlPct(entryPrice, exitPrice),
                    barsHeld,
                    reason
            );
        }
    }
}
