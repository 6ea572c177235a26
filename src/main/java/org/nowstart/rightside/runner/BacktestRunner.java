package org.nowstart.rightside.runner;

import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rightside.data.dto.BacktestSuiteResult;
import org.nowstart.rightside.data.dto.SymbolBacktestResult;
import org.nowstart.rightside.data.dto.SymbolFailure;
import org.nowstart.rightside.data.property.BacktestProperties;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.service.BacktestSuiteService;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties backtestProperties;
    private final BacktestSuiteService backtestSuiteService;

    @Override
    public void run(ApplicationArguments args) {
        if (!backtestProperties.runnerEnabled()) {
            log.info("rightside.backtest.runner-enabled=false; pass --rightside.backtest.runner-enabled=true to run");
            return;
        }

        logSection("RIGHT SIDE OF V BACKTEST");
        log.info("[Overview] symbols={} from={} to={} parallelism={} failFast={}",
                backtestProperties.symbols().isEmpty() ? "ALL" : backtestProperties.symbols(),
                backtestProperties.from(),
                backtestProperties.to(),
                backtestProperties.parallelism(),
                backtestProperties.failFast());

        BacktestSuiteResult result = backtestSuiteService.runConfigured();
        report(result);
    }

    void report(BacktestSuiteResult result) {
        logSection("COMBINED PERFORMANCE (" + result.totalTrades() + " total trades)");
        PerformanceMetrics metrics = result.combinedMetrics();
        if (metrics.isEmpty()) {
            log.info("[Combined] no trades found - no metrics to display");
        } else {
            log.info("[Combined] winRate={} profitFactor={} totalPnl={} worstTrade={} recoveryFactor={}",
                    formatPercent(metrics.winRate()),
                    formatRatio(metrics.profitFactor()),
                    formatPercent(metrics.totalPnl()),
                    formatPercent(metrics.worstTradePnl()),
                    formatRatio(metrics.recoveryFactor()));
            log.info("[Combined] avgWin={} avgLoss={} avgBarsHeld={} largestWin={} largestLoss={} tradesByType={}",
                    formatPercent(metrics.avgWin()),
                    formatPercent(metrics.avgLoss()),
                    String.format(Locale.US, "%.1f", metrics.avgBarsHeld()),
                    formatPercent(metrics.largestWin()),
                    formatPercent(metrics.largestLoss()),
                    metrics.tradesByType());
        }

        logSection("PER SYMBOL");
        for (Map.Entry<String, SymbolBacktestResult> entry : result.results().entrySet()) {
            SymbolBacktestResult symbolResult = entry.getValue();
            PerformanceMetrics symbolMetrics = symbolResult.metrics();
            log.info("[{}] bars={} capitulations={} pivotLows={} triggers={} trades={} winRate={} pnl={} pf={}",
                    entry.getKey(),
                    symbolResult.dataPoints(),
                    symbolResult.capitulationPoints(),
                    symbolResult.pivotLows(),
                    symbolResult.entryTriggers(),
                    symbolResult.trades().size(),
                    formatPercent(symbolMetrics.winRate()),
                    formatPercent(symbolMetrics.totalPnl()),
                    formatRatio(symbolMetrics.profitFactor()));
        }
        for (SymbolFailure failure : result.failures()) {
            log.warn("[{}] failed stage={} message={}", failure.symbol(), failure.stage(), failure.message());
        }
        logSection("BACKTEST END");
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    // metric values are already percentages
    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value);
    }

    private String formatRatio(double value) {
        if (Double.isInfinite(value)) {
            return "inf";
        }
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f", value);
    }
}
