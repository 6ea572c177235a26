package org.nowstart.rightside.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.nowstart.rightside.engine.EngineFixtures.at;
import static org.nowstart.rightside.engine.EngineFixtures.chicago;
import static org.nowstart.rightside.engine.EngineFixtures.indicatorBar;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.data.type.ExitReason;
import org.nowstart.rightside.data.type.TradeStatus;
import org.nowstart.rightside.engine.core.EntryTrigger;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.nowstart.rightside.engine.core.Trade;

class TradeSimulatorTest {

    private final TradeSimulator simulator = new TradeSimulator();
    private final StrategyParams params = StrategyParams.defaults();

    @Test
    void simulate_exitsAtPreviousLowWhenBroken() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(at(1), 100.2, 101.0, 99.5, 100.8),
                indicatorBar(at(2), 100.5, 100.6, 99.0, 99.2)
        );

        Trade trade = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);

        assertThat(trade.exitReason()).isEqualTo(ExitReason.PREV_CANDLE_LOW);
        assertThat(trade.exitPrice()).isEqualTo(99.5);
        assertThat(trade.exitTime()).isEqualTo(at(2));
        assertThat(trade.barsHeld()).isEqualTo(2);
        assertThat(trade.pnlPct()).isCloseTo(-0.5, within(1e-9));
        assertThat(trade.status()).isEqualTo(TradeStatus.CLOSED);
    }

    @Test
    void simulate_gapBelowStopExitsAtOpen() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(at(1), 100.2, 101.0, 99.5, 100.8),
                indicatorBar(at(2), 99.3, 99.4, 98.5, 98.8)
        );

        Trade trade = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);

        assertThat(trade.exitReason()).isEqualTo(ExitReason.PREV_CANDLE_LOW);
        assertThat(trade.exitPrice()).isEqualTo(99.3);
    }

    @Test
    void simulate_equalLowDoesNotStopOut() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(at(1), 100.2, 101.0, 99.0, 100.8)
        );

        Trade trade = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);

        assertThat(trade.exitReason()).isEqualTo(ExitReason.END_OF_SLICE);
    }

    @Test
    void simulate_closesAtExitHour() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(chicago("2024-03-05T14:56:00"), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(chicago("2024-03-05T14:58:00"), 100.0, 100.8, 99.4, 100.6),
                indicatorBar(chicago("2024-03-05T15:00:00"), 100.6, 101.2, 99.8, 101.0),
                indicatorBar(chicago("2024-03-05T15:02:00"), 101.0, 102.0, 100.5, 101.8)
        );

        Trade trade = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);

        assertThat(trade.exitReason()).isEqualTo(ExitReason.EOD_1500);
        assertThat(trade.exitPrice()).isEqualTo(101.0);
        assertThat(trade.barsHeld()).isEqualTo(2);
    }

    @Test
    void simulate_forceClosesAtNextDayOpen() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(chicago("2024-03-05T14:58:00"), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(chicago("2024-03-06T08:30:00"), 101.5, 102.0, 98.0, 99.0)
        );

        Trade trade = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);

        assertThat(trade.exitReason()).isEqualTo(ExitReason.NEXT_DAY_FORCE_CLOSE);
        assertThat(trade.exitPrice()).isEqualTo(101.5);
        assertThat(trade.barsHeld()).isZero();
        assertThat(trade.pnlPct()).isCloseTo(1.5, within(1e-9));
    }

    @Test
    void simulate_closesAtLastSliceBarWhenNothingFires() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(at(1), 100.0, 100.8, 99.4, 100.6),
                indicatorBar(at(2), 100.6, 101.2, 99.8, 101.0),
                indicatorBar(at(3), 101.0, 102.0, 100.5, 101.8)
        );

        Trade full = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);
        Trade capped = simulator.simulate(bars, List.of(trigger(0, 98.0)), EngineFixtures.params(10, 2)).get(0);

        assertThat(full.exitReason()).isEqualTo(ExitReason.END_OF_SLICE);
        assertThat(full.exitPrice()).isEqualTo(101.8);
        assertThat(full.barsHeld()).isEqualTo(3);
        assertThat(capped.exitReason()).isEqualTo(ExitReason.END_OF_SLICE);
        assertThat(capped.exitTime()).isEqualTo(at(1));
        assertThat(capped.exitPrice()).isEqualTo(100.6);
    }

    @Test
    void simulate_entryOnLastBarClosesImmediately() {
        List<IndicatorBar> bars = List.of(indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0));

        Trade trade = simulator.simulate(bars, List.of(trigger(0, 98.0)), params).get(0);

        assertThat(trade.exitReason()).isEqualTo(ExitReason.END_OF_SLICE);
        assertThat(trade.pnlPct()).isZero();
        assertThat(trade.barsHeld()).isZero();
    }

    @Test
    void simulate_usesFallbackStopAndRiskFloor() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(at(1), 100.0, 100.8, 99.4, 100.6)
        );

        Trade fallback = simulator.simulate(bars, List.of(trigger(0, Double.NaN)), params).get(0);
        Trade aboveEntry = simulator.simulate(bars, List.of(trigger(0, 101.0)), params).get(0);

        assertThat(fallback.initialStop()).isCloseTo(98.0, within(1e-9));
        assertThat(fallback.entryRisk()).isCloseTo(2.0, within(1e-9));
        assertThat(aboveEntry.initialStop()).isEqualTo(101.0);
        assertThat(aboveEntry.entryRisk()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void simulate_returnsOneClosedTradePerTriggerInBarOrder() {
        List<IndicatorBar> bars = List.of(
                indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0),
                indicatorBar(at(1), 100.0, 100.8, 99.4, 100.6),
                indicatorBar(at(2), 100.6, 101.2, 99.8, 101.0)
        );

        List<Trade> trades = simulator.simulate(bars, List.of(trigger(1, 99.0), trigger(0, 98.0)), params);

        assertThat(trades).hasSize(2);
        assertThat(trades).allMatch(Trade::isClosed);
        assertThat(trades).extracting(Trade::entryTime).containsExactly(at(0), at(1));
        assertThat(trades.get(0).pnlPct()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void simulate_rejectsTriggerOutsideBars() {
        List<IndicatorBar> bars = List.of(indicatorBar(at(0), 99.5, 100.5, 99.0, 100.0));

        assertThatThrownBy(() -> simulator.simulate(bars, List.of(trigger(3, 98.0)), params))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private EntryTrigger trigger(int barIndex, double stop) {
        return new EntryTrigger(barIndex, 0, 0, at(barIndex), EntryType.V_TURN, stop);
    }
}
