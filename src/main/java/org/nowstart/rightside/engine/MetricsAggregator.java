package org.nowstart.rightside.engine;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.engine.core.Trade;
import org.springframework.stereotype.Component;

@Component
public class MetricsAggregator {

    public PerformanceMetrics aggregate(List<Trade> trades) {
        if (trades == null || trades.isEmpty()) {
            return PerformanceMetrics.empty();
        }

        List<Trade> closed = trades.stream()
                .filter(trade -> trade != null && trade.isClosed())
                .toList();
        if (closed.isEmpty()) {
            return PerformanceMetrics.empty();
        }

        int total = closed.size();
        int winCount = 0;
        int lossCount = 0;
        double winSum = 0.0;
        double lossSum = 0.0;
        double totalPnl = 0.0;
        double largest = Double.NEGATIVE_INFINITY;
        double worst = Double.POSITIVE_INFINITY;
        long barsHeldSum = 0L;
        Map<EntryType, Long> byType = new EnumMap<>(EntryType.class);

        for (Trade trade : closed) {
            double pnl = trade.pnlPct();
            totalPnl += pnl;
            largest = Math.max(largest, pnl);
            worst = Math.min(worst, pnl);
            barsHeldSum += trade.barsHeld();
            if (pnl > 0.0) {
                winCount++;
                winSum += pnl;
            } else if (pnl < 0.0) {
                lossCount++;
                lossSum += pnl;
            }
            if (trade.entryType() != null) {
                byType.merge(trade.entryType(), 1L, Long::sum);
            }
        }

        double grossLoss = Math.abs(lossSum);
        double profitFactor = grossLoss > 0.0 ? winSum / grossLoss : Double.POSITIVE_INFINITY;
        double recoveryFactor = worst < 0.0 ? winSum / Math.abs(worst) : Double.POSITIVE_INFINITY;

        return new PerformanceMetrics(
                total,
                (winCount * 100.0) / total,
                winCount > 0 ? winSum / winCount : 0.0,
                lossCount > 0 ? lossSum / lossCount : 0.0,
                profitFactor,
                totalPnl,
                worst,
                recoveryFactor,
                (double) barsHeldSum / total,
                largest,
                worst,
                byType
        );
    }
}
