package org.nowstart.rightside.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.time.Instant;
import org.nowstart.rightside.data.dto.BacktestSuiteRequest;
import org.nowstart.rightside.data.dto.BacktestSuiteResult;
import org.nowstart.rightside.data.dto.ChartDataDto;
import org.nowstart.rightside.data.dto.SymbolBacktestResult;
import org.nowstart.rightside.data.dto.SymbolListDto;
import org.nowstart.rightside.data.exception.BacktestApiException;
import org.nowstart.rightside.service.BacktestService;
import org.nowstart.rightside.service.BacktestSuiteService;
import org.nowstart.rightside.service.BarLoadService;
import org.nowstart.rightside.service.ChartDataService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/backtest")
@Tag(name = "Backtest", description = "Symbol list, per-symbol backtest, chart data and suite runs")
public class BacktestController {

    private final BarLoadService barLoadService;
    private final BacktestService backtestService;
    private final BacktestSuiteService backtestSuiteService;
    private final ChartDataService chartDataService;

    public BacktestController(
            BarLoadService barLoadService,
            BacktestService backtestService,
            BacktestSuiteService backtestSuiteService,
            ChartDataService chartDataService
    ) {
        this.barLoadService = barLoadService;
        this.backtestService = backtestService;
        this.backtestSuiteService = backtestSuiteService;
        this.chartDataService = chartDataService;
    }

    @GetMapping("/symbols")
    @Operation(summary = "Symbol list", description = "Distinct symbols present in the bar store.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK")
    })
    public SymbolListDto getSymbols() {
        return new SymbolListDto(barLoadService.findSymbols());
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "Backtest one symbol", description = "Runs the strategy over the symbol's bars and returns counts, triggers, trades and metrics.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "500", description = "Pipeline stage failed")
    })
    public SymbolBacktestResult getBacktest(
            @PathVariable String symbol,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to
    ) {
        validateRange(from, to);
        return backtestService.backtestSymbol(symbol, from, to);
    }

    @GetMapping("/{symbol}/chart")
    @Operation(summary = "Chart data", description = "Candles, volume, VWAP/EMA lines and trade markers with epoch-second times.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "404", description = "No bars for symbol")
    })
    public ChartDataDto getChart(
            @PathVariable String symbol,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to
    ) {
        validateRange(from, to);
        return chartDataService.buildChart(symbol, from, to);
    }

    @PostMapping("/suite")
    @Operation(summary = "Run suite", description = "Backtests the requested symbols, or every symbol when none are given.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "OK"),
            @ApiResponse(responseCode = "400", description = "Request validation failed")
    })
    public BacktestSuiteResult runSuite(@RequestBody @Valid BacktestSuiteRequest request) {
        validateRange(request.from(), request.to());
        return backtestSuiteService.run(request.symbols(), request.from(), request.to());
    }

    private void validateRange(Instant from, Instant to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw BacktestApiException.invalidRange(from, to);
        }
    }
}
