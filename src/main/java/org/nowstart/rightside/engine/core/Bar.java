package org.nowstart.rightside.engine.core;

import java.time.Instant;

/**
 * One 2-minute bar as supplied by the bar store.
 *
 * <p>{@code relativeVolume}, {@code rsi} and {@code vwap} are computed upstream; the engine never
 * recomputes them.
 */
public record Bar(
        Instant timestamp,
        double open,
        double high,
        double low,
        double close,
        double volume,
        double relativeVolume,
        double rsi,
        double vwap
) {
}
