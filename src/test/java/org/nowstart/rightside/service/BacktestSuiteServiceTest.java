package org.nowstart.rightside.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.rightside.data.dto.BacktestSuiteResult;
import org.nowstart.rightside.data.dto.SymbolBacktestResult;
import org.nowstart.rightside.data.exception.BacktestStageException;
import org.nowstart.rightside.data.property.BacktestProperties;
import org.nowstart.rightside.data.type.BacktestStage;
import org.nowstart.rightside.data.type.EntryType;
import org.nowstart.rightside.data.type.ExitReason;
import org.nowstart.rightside.data.type.TradeStatus;
import org.nowstart.rightside.engine.MetricsAggregator;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.nowstart.rightside.engine.core.Trade;
import org.springframework.core.task.SyncTaskExecutor;

@ExtendWith(MockitoExtension.class)
class BacktestSuiteServiceTest {

    private static final StrategyParams PARAMS = StrategyParams.defaults();

    @Mock
    private BacktestService backtestService;
    @Mock
    private BarLoadService barLoadService;

    @BeforeEach
    void setUp() {
        lenient().when(backtestService.resolveParams()).thenReturn(PARAMS);
        lenient().when(barLoadService.normalizeSymbol(anyString()))
                .thenAnswer(invocation -> invocation.<String>getArgument(0).trim().toUpperCase(Locale.ROOT));
    }

    @Test
    void run_combinesTradesOfAllSymbolsInRequestOrder() {
        when(backtestService.backtestSymbol("SPY", null, null, PARAMS)).thenReturn(result("SPY", 2.0));
        when(backtestService.backtestSymbol("QQQ", null, null, PARAMS)).thenReturn(result("QQQ", -1.0));

        BacktestSuiteResult suite = suite(false).run(List.of("spy", "QQQ", "SPY"), null, null);

        assertThat(suite.results().keySet()).containsExactly("SPY", "QQQ");
        assertThat(suite.failures()).isEmpty();
        assertThat(suite.totalTrades()).isEqualTo(2);
        assertThat(suite.combinedMetrics().totalTrades()).isEqualTo(2);
        assertThat(suite.combinedMetrics().totalPnl()).isEqualTo(1.0);
    }

    @Test
    void run_emptyRequestMeansEverySymbolInStore() {
        when(barLoadService.findSymbols()).thenReturn(List.of("IWM"));
        when(backtestService.backtestSymbol("IWM", null, null, PARAMS)).thenReturn(SymbolBacktestResult.empty("IWM"));

        BacktestSuiteResult suite = suite(false).run(List.of(), null, null);

        assertThat(suite.results()).containsOnlyKeys("IWM");
        assertThat(suite.totalTrades()).isZero();
        assertThat(suite.combinedMetrics().isEmpty()).isTrue();
    }

    @Test
    void run_failingSymbolIsReportedAndExcludedFromCombinedMetrics() {
        when(backtestService.backtestSymbol("SPY", null, null, PARAMS)).thenReturn(result("SPY", 2.0));
        when(backtestService.backtestSymbol("BAD", null, null, PARAMS))
                .thenThrow(new BacktestStageException(BacktestStage.LOAD, "BAD", "bar store did not supply vwap"));

        BacktestSuiteResult suite = suite(false).run(List.of("BAD", "SPY"), null, null);

        assertThat(suite.failures()).hasSize(1);
        assertThat(suite.failures().get(0).symbol()).isEqualTo("BAD");
        assertThat(suite.failures().get(0).stage()).isEqualTo(BacktestStage.LOAD);
        assertThat(suite.results().get("BAD").isEmpty()).isTrue();
        assertThat(suite.totalTrades()).isEqualTo(1);
        assertThat(suite.combinedMetrics().totalPnl()).isEqualTo(2.0);
    }

    @Test
    void run_failFastRethrowsFirstFailure() {
        when(backtestService.backtestSymbol("BAD", null, null, PARAMS))
                .thenThrow(new BacktestStageException(BacktestStage.INDICATORS, "BAD", "unordered"));

        assertThatThrownBy(() -> suite(true).run(List.of("BAD"), null, null))
                .isInstanceOf(BacktestStageException.class)
                .hasMessageContaining("unordered");
    }

    @Test
    void runConfigured_usesConfiguredSymbolsAndRange() {
        Instant from = Instant.parse("2024-03-01T00:00:00Z");
        Instant to = Instant.parse("2024-03-31T00:00:00Z");
        BacktestProperties properties = new BacktestProperties(true, List.of("spy"), from, to, 2, false);
        when(backtestService.backtestSymbol("SPY", from, to, PARAMS)).thenReturn(SymbolBacktestResult.empty("SPY"));

        BacktestSuiteResult suite = suite(properties).runConfigured();

        assertThat(suite.results()).containsOnlyKeys("SPY");
        verify(barLoadService, never()).findSymbols();
        verify(backtestService).backtestSymbol("SPY", from, to, PARAMS);
    }

    @Test
    void resolveSymbols_dropsBlankAndDuplicateEntries() {
        List<String> symbols = suite(false).resolveSymbols(List.of(" spy", "", "SPY ", "qqq"));

        assertThat(symbols).containsExactly("SPY", "QQQ");
    }

    private BacktestSuiteService suite(boolean failFast) {
        return suite(new BacktestProperties(false, List.of(), null, null, 2, failFast));
    }

    private BacktestSuiteService suite(BacktestProperties properties) {
        return new BacktestSuiteService(
                backtestService,
                barLoadService,
                new MetricsAggregator(),
                properties,
                new SyncTaskExecutor()
        );
    }

    private SymbolBacktestResult result(String symbol, double pnlPct) {
        Instant entry = Instant.parse("2024-03-05T15:20:00Z");
        Trade trade = new Trade(
                entry,
                100.0,
                99.0,
                EntryType.V_TURN,
                1.0,
                entry.plusSeconds(360),
                100.0 + pnlPct,
                TradeStatus.CLOSED,
                pnlPct,
                3,
                ExitReason.PREV_CANDLE_LOW
        );
        PerformanceMetrics metrics = new MetricsAggregator().aggregate(List.of(trade));
        return new SymbolBacktestResult(
                symbol, List.of(), new boolean[0], new boolean[0], List.of(), List.of(trade), 60, 1, 0, 1, metrics
        );
    }
}
