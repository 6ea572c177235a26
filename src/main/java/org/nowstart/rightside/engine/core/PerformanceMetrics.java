package org.nowstart.rightside.engine.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.Map;
import org.nowstart.rightside.data.type.EntryType;

/**
 * Summary statistics over closed trades. All pnl values are percentages.
 *
 * <p>{@code worstTradePnl} is the single worst trade's pnl, not a drawdown of a cumulative equity
 * curve. {@code profitFactor} and {@code recoveryFactor} are {@link Double#POSITIVE_INFINITY} when
 * their denominator is zero.
 */
public record PerformanceMetrics(
        int totalTrades,
        double winRate,
        double avgWin,
        double avgLoss,
        double profitFactor,
        double totalPnl,
        double worstTradePnl,
        double recoveryFactor,
        double avgBarsHeld,
        double largestWin,
        double largestLoss,
        Map<EntryType, Long> tradesByType
) {

    public PerformanceMetrics {
        tradesByType = tradesByType == null ? Map.of() : Map.copyOf(tradesByType);
    }

    public static PerformanceMetrics empty() {
        return new PerformanceMetrics(0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, Map.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalTrades == 0;
    }
}
