package org.nowstart.rightside.engine.core;

import java.time.Instant;

/**
 * A {@link Bar} enriched with the derived indicator fields. Values that need more history than
 * is available are {@link Double#NaN}.
 */
public record IndicatorBar(
        Bar bar,
        double atr,
        double ema9,
        double vwapDistancePct,
        double vwapDistanceStd,
        double rollingMax20,
        double dropAtr
) {

    public Instant timestamp() {
        return bar.timestamp();
    }

    public double open() {
        return bar.open();
    }

    public double high() {
        return bar.high();
    }

    public double low() {
        return bar.low();
    }

    public double close() {
        return bar.close();
    }

    public double volume() {
        return bar.volume();
    }

    public double relativeVolume() {
        return bar.relativeVolume();
    }

    public double rsi() {
        return bar.rsi();
    }

    public double vwap() {
        return bar.vwap();
    }
}
