package org.nowstart.rightside.service;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rightside.data.dto.SymbolBacktestResult;
import org.nowstart.rightside.data.exception.BacktestStageException;
import org.nowstart.rightside.data.property.StrategyProperties;
import org.nowstart.rightside.data.type.BacktestStage;
import org.nowstart.rightside.engine.CapitulationDetector;
import org.nowstart.rightside.engine.EntryTriggerEngine;
import org.nowstart.rightside.engine.IndicatorPipeline;
import org.nowstart.rightside.engine.MetricsAggregator;
import org.nowstart.rightside.engine.PivotLocator;
import org.nowstart.rightside.engine.TradeSimulator;
import org.nowstart.rightside.engine.core.Bar;
import org.nowstart.rightside.engine.core.EntryTrigger;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.nowstart.rightside.engine.core.Trade;
import org.springframework.cloud.context.config.annotation.RefreshScope;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RefreshScope
@RequiredArgsConstructor
public class BacktestService {

    private final BarLoadService barLoadService;
    private final IndicatorPipeline indicatorPipeline;
    private final CapitulationDetector capitulationDetector;
    private final PivotLocator pivotLocator;
    private final EntryTriggerEngine entryTriggerEngine;
    private final TradeSimulator tradeSimulator;
    private final MetricsAggregator metricsAggregator;
    private final StrategyProperties strategyProperties;

    public StrategyParams resolveParams() {
        return strategyProperties.toStrategyParams();
    }

    public SymbolBacktestResult backtestSymbol(String symbol, Instant from, Instant to) {
        return backtestSymbol(symbol, from, to, resolveParams());
    }

    public SymbolBacktestResult backtestSymbol(String symbol, Instant from, Instant to, StrategyParams params) {
        String market = barLoadService.normalizeSymbol(symbol);
        List<Bar> bars = runStage(BacktestStage.LOAD, market, () -> barLoadService.loadBars(market, from, to, params.zoneId()));
        return backtestBars(market, bars, params);
    }

    public SymbolBacktestResult backtestBars(String symbol, List<Bar> loadedBars, StrategyParams params) {
        if (loadedBars == null || loadedBars.isEmpty()) {
            log.info("Backtest skipped, no bars. symbol={}", symbol);
            return SymbolBacktestResult.empty(symbol);
        }

        List<Bar> bars = runStage(BacktestStage.LOAD, symbol, () -> barLoadService.filterSession(loadedBars, params));
        if (bars.isEmpty()) {
            log.info("Backtest skipped, no bars inside session window. symbol={}", symbol);
            return SymbolBacktestResult.empty(symbol);
        }

        List<IndicatorBar> indicators = runStage(
                BacktestStage.INDICATORS, symbol, () -> indicatorPipeline.derive(bars, params));
        boolean[] capitulations = runStage(
                BacktestStage.CAPITULATION, symbol, () -> capitulationDetector.detect(indicators, params));
        boolean[] pivots = runStage(
                BacktestStage.PIVOTS, symbol, () -> pivotLocator.locate(indicators, capitulations, params));
        List<EntryTrigger> triggers = runStage(
                BacktestStage.ENTRY_TRIGGERS, symbol, () -> entryTriggerEngine.scan(indicators, capitulations, params));
        List<Trade> trades = runStage(
                BacktestStage.SIMULATION, symbol, () -> tradeSimulator.simulate(indicators, triggers, params));
        PerformanceMetrics metrics = runStage(
                BacktestStage.METRICS, symbol, () -> metricsAggregator.aggregate(trades));

        SymbolBacktestResult result = new SymbolBacktestResult(
                symbol,
                indicators,
                capitulations,
                pivots,
                triggers,
                trades,
                indicators.size(),
                CapitulationDetector.count(capitulations),
                CapitulationDetector.count(pivots),
                triggers.size(),
                metrics
        );
        log.info(
                "Backtest finished. symbol={}, bars={}, capitulations={}, pivotLows={}, triggers={}, trades={}, totalPnl={}",
                symbol,
                result.dataPoints(),
                result.capitulationPoints(),
                result.pivotLows(),
                result.entryTriggers(),
                trades.size(),
                metrics.totalPnl()
        );
        return result;
    }

    private <T> T runStage(BacktestStage stage, String symbol, Supplier<T> stageBody) {
        try {
            return stageBody.get();
        } catch (BacktestStageException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new BacktestStageException(stage, symbol, String.valueOf(e.getMessage()), e);
        }
    }
}
