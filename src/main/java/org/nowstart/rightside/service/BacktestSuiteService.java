package org.nowstart.rightside.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rightside.data.dto.BacktestSuiteResult;
import org.nowstart.rightside.data.dto.SymbolBacktestResult;
import org.nowstart.rightside.data.dto.SymbolFailure;
import org.nowstart.rightside.data.exception.BacktestStageException;
import org.nowstart.rightside.data.property.BacktestProperties;
import org.nowstart.rightside.engine.MetricsAggregator;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.nowstart.rightside.engine.core.Trade;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Runs the per-symbol backtest over a set of symbols on the {@code backtestExecutor} pool.
 *
 * <p>Each symbol owns its own state. A failing symbol is reported as a {@link SymbolFailure} and
 * contributes nothing to the combined metrics; with {@code fail-fast} enabled the first failure
 * is rethrown instead.
 */
@Slf4j
@Service
public class BacktestSuiteService {

    private final BacktestService backtestService;
    private final BarLoadService barLoadService;
    private final MetricsAggregator metricsAggregator;
    private final BacktestProperties backtestProperties;
    private final TaskExecutor backtestExecutor;

    public BacktestSuiteService(
            BacktestService backtestService,
            BarLoadService barLoadService,
            MetricsAggregator metricsAggregator,
            BacktestProperties backtestProperties,
            @Qualifier("backtestExecutor") TaskExecutor backtestExecutor
    ) {
        this.backtestService = backtestService;
        this.barLoadService = barLoadService;
        this.metricsAggregator = metricsAggregator;
        this.backtestProperties = backtestProperties;
        this.backtestExecutor = backtestExecutor;
    }

    public BacktestSuiteResult runConfigured() {
        return run(backtestProperties.symbols(), backtestProperties.from(), backtestProperties.to());
    }

    public BacktestSuiteResult run(List<String> requestedSymbols, Instant from, Instant to) {
        return run(requestedSymbols, from, to, backtestService.resolveParams());
    }

    public BacktestSuiteResult run(List<String> requestedSymbols, Instant from, Instant to, StrategyParams params) {
        List<String> symbols = resolveSymbols(requestedSymbols);
        log.info("Backtest suite started. symbols={}, from={}, to={}, failFast={}",
                symbols.size(), from, to, backtestProperties.failFast());

        Map<String, CompletableFuture<SymbolOutcome>> futures = new LinkedHashMap<>();
        for (String symbol : symbols) {
            futures.put(symbol, CompletableFuture.supplyAsync(
                    () -> runSymbol(symbol, from, to, params),
                    backtestExecutor
            ));
        }

        Map<String, SymbolBacktestResult> results = new LinkedHashMap<>();
        List<SymbolFailure> failures = new ArrayList<>();
        List<Trade> combinedTrades = new ArrayList<>();
        for (Map.Entry<String, CompletableFuture<SymbolOutcome>> entry : futures.entrySet()) {
            SymbolOutcome outcome = join(entry.getValue());
            results.put(entry.getKey(), outcome.result());
            if (outcome.failure() != null) {
                failures.add(outcome.failure());
                if (backtestProperties.failFast()) {
                    futures.values().forEach(future -> future.cancel(true));
                    throw outcome.cause();
                }
                continue;
            }
            combinedTrades.addAll(outcome.result().trades());
        }

        PerformanceMetrics combined = metricsAggregator.aggregate(combinedTrades);
        log.info("Backtest suite finished. symbols={}, failures={}, totalTrades={}, totalPnl={}",
                symbols.size(), failures.size(), combinedTrades.size(), combined.totalPnl());
        return new BacktestSuiteResult(results, failures, combined, combinedTrades.size());
    }

    List<String> resolveSymbols(List<String> requestedSymbols) {
        List<String> source = requestedSymbols == null || requestedSymbols.isEmpty()
                ? barLoadService.findSymbols()
                : requestedSymbols;
        Set<String> symbols = new LinkedHashSet<>();
        for (String symbol : source) {
            String normalized = barLoadService.normalizeSymbol(symbol);
            if (!normalized.isEmpty()) {
                symbols.add(normalized);
            }
        }
        return List.copyOf(symbols);
    }

    private SymbolOutcome runSymbol(String symbol, Instant from, Instant to, StrategyParams params) {
        try {
            return new SymbolOutcome(backtestService.backtestSymbol(symbol, from, to, params), null, null);
        } catch (BacktestStageException e) {
            log.error("Backtest failed. symbol={}, stage={}", symbol, e.getStage(), e);
            return new SymbolOutcome(
                    SymbolBacktestResult.empty(symbol),
                    new SymbolFailure(symbol, e.getStage(), e.getMessage()),
                    e
            );
        }
    }

    private SymbolOutcome join(CompletableFuture<SymbolOutcome> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw e;
        }
    }

    private record SymbolOutcome(
            SymbolBacktestResult result,
            SymbolFailure failure,
            BacktestStageException cause
    ) {
    }
}
