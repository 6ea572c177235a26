package org.nowstart.rightside.engine;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.rightside.engine.core.Bar;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;

public final class EngineFixtures {

    // 2024-03-05 08:30 America/Chicago (CST, UTC-6)
    public static final Instant SESSION_OPEN = Instant.parse("2024-03-05T14:30:00Z");

    private EngineFixtures() {
    }

    public static Instant at(int index) {
        return SESSION_OPEN.plus(Duration.ofMinutes(2L * index));
    }

    public static Instant chicago(String localDateTime) {
        return LocalDateTime.parse(localDateTime).atZone(StrategyParams.DEFAULT_ZONE).toInstant();
    }

    public static Bar bar(Instant ts, double open, double high, double low, double close) {
        return new Bar(ts, open, high, low, close, 1000.0, 1.0, 50.0, close);
    }

    public static IndicatorBar indicatorBar(Instant ts, double open, double high, double low, double close) {
        return indicatorBar(ts, open, high, low, close, 1.0, close);
    }

    public static IndicatorBar indicatorBar(
            Instant ts,
            double open,
            double high,
            double low,
            double close,
            double relativeVolume,
            double ema9
    ) {
        Bar bar = new Bar(ts, open, high, low, close, 1000.0, relativeVolume, 50.0, close);
        return new IndicatorBar(bar, 1.0, ema9, 0.0, 0.0, close, 0.0);
    }

    public static IndicatorBar flat(int index) {
        return indicatorBar(at(index), 100.0, 100.5, 99.5, 100.0);
    }

    /**
     * 60 bars from the session open: a capitulation at bar 20, the V-bottom low at bar 22 (96.0),
     * a v-turn reclaim at bar 25 (close 98.2) and a break of the previous low at bar 28.
     */
    public static List<Bar> capitulationScenario() {
        List<Bar> bars = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            bars.add(new Bar(at(i), 100.0, 100.2, 99.8, 100.0, 1000.0, 1.0, 50.0, 100.0));
        }
        // ATR(14) = 0.6, drop = (100 - 97) / 0.6 = 5 ATR, 1.5% under VWAP
        bars.add(new Bar(at(20), 99.5, 99.6, 96.8, 97.0, 5000.0, 2.0, 30.0, 98.5));
        bars.add(new Bar(at(21), 97.0, 97.5, 96.5, 96.8, 3000.0, 1.2, 28.0, 96.8));
        bars.add(new Bar(at(22), 96.8, 97.0, 96.0, 96.3, 3000.0, 1.2, 25.0, 96.3));
        bars.add(new Bar(at(23), 96.3, 96.9, 96.2, 96.7, 2000.0, 1.0, 30.0, 96.7));
        bars.add(new Bar(at(24), 96.7, 97.0, 96.4, 96.8, 2000.0, 1.0, 32.0, 96.8));
        bars.add(new Bar(at(25), 96.9, 98.3, 96.8, 98.2, 4000.0, 2.0, 40.0, 98.2));
        bars.add(new Bar(at(26), 98.2, 98.8, 97.9, 98.6, 2000.0, 1.0, 45.0, 98.6));
        bars.add(new Bar(at(27), 98.6, 99.2, 98.3, 99.0, 2000.0, 1.0, 48.0, 99.0));
        bars.add(new Bar(at(28), 99.0, 99.1, 98.0, 98.1, 2000.0, 1.0, 44.0, 98.1));
        for (int i = 29; i < 60; i++) {
            bars.add(new Bar(at(i), 99.0, 99.3, 98.7, 99.0, 1000.0, 1.0, 50.0, 99.0));
        }
        return List.copyOf(bars);
    }

    public static StrategyParams params(int pivotWindow, int maxHoldBars) {
        return new StrategyParams(
                1.5,
                0.5,
                3.0,
                35.0,
                14,
                9,
                20,
                pivotWindow,
                20,
                40,
                1.5,
                0.025,
                5,
                0.0005,
                15,
                15,
                maxHoldBars,
                0.02,
                0.01,
                StrategyParams.DEFAULT_ZONE,
                false,
                LocalTime.of(8, 30),
                LocalTime.of(15, 0)
        );
    }

    public static StrategyParams sessionFiltered() {
        return new StrategyParams(
                1.5, 0.5, 3.0, 35.0, 14, 9, 20, 10, 20, 40, 1.5, 0.025, 5, 0.0005, 15, 15, 250, 0.02, 0.01,
                StrategyParams.DEFAULT_ZONE,
                true,
                LocalTime.of(8, 30),
                LocalTime.of(15, 0)
        );
    }
}
