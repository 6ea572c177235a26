package org.nowstart.rightside.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rightside.data.dto.CandlePointDto;
import org.nowstart.rightside.data.dto.ChartDataDto;
import org.nowstart.rightside.data.dto.LinePointDto;
import org.nowstart.rightside.data.dto.SymbolBacktestResult;
import org.nowstart.rightside.data.dto.TradeMarkerDto;
import org.nowstart.rightside.data.dto.TradeMarkerDto.MarkerKind;
import org.nowstart.rightside.data.dto.VolumePointDto;
import org.nowstart.rightside.data.exception.BacktestApiException;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.Trade;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class ChartDataService {

    static final String VOLUME_UP_COLOR = "rgba(0, 150, 136, 0.5)";
    static final String VOLUME_DOWN_COLOR = "rgba(255, 82, 82, 0.5)";
    static final String ENTRY_COLOR = "#2196F3";
    static final String EXIT_WIN_COLOR = "#4CAF50";
    static final String EXIT_LOSS_COLOR = "#F44336";

    private final BacktestService backtestService;

    public ChartDataDto buildChart(String symbol, Instant from, Instant to) {
        SymbolBacktestResult result = backtestService.backtestSymbol(symbol, from, to);
        if (result.isEmpty()) {
            throw BacktestApiException.symbolDataNotFound(result.symbol());
        }
        ChartDataDto chart = toChart(result);
        log.debug("Chart built. symbol={}, candles={}, markers={}", chart.symbol(), chart.ohlc().size(), chart.markers().size());
        return chart;
    }

    ChartDataDto toChart(SymbolBacktestResult result) {
        List<IndicatorBar> bars = result.bars();
        List<CandlePointDto> ohlc = new ArrayList<>(bars.size());
        List<VolumePointDto> volume = new ArrayList<>(bars.size());
        List<LinePointDto> vwap = new ArrayList<>(bars.size());
        List<LinePointDto> ema = new ArrayList<>(bars.size());

        for (IndicatorBar bar : bars) {
            long time = bar.timestamp().getEpochSecond();
            ohlc.add(new CandlePointDto(time, bar.open(), bar.high(), bar.low(), bar.close()));
            volume.add(new VolumePointDto(
                    time,
                    bar.volume(),
                    bar.close() >= bar.open() ? VOLUME_UP_COLOR : VOLUME_DOWN_COLOR
            ));
            if (!Double.isNaN(bar.vwap())) {
                vwap.add(new LinePointDto(time, bar.vwap()));
            }
            if (!Double.isNaN(bar.ema9())) {
                ema.add(new LinePointDto(time, bar.ema9()));
            }
        }

        return new ChartDataDto(
                result.symbol(),
                List.copyOf(ohlc),
                List.copyOf(volume),
                List.copyOf(vwap),
                List.copyOf(ema),
                markers(result.trades()),
                result.trades(),
                result.metrics()
        );
    }

    List<TradeMarkerDto> markers(List<Trade> trades) {
        List<TradeMarkerDto> markers = new ArrayList<>(trades.size() * 2);
        for (Trade trade : trades) {
            markers.add(new TradeMarkerDto(
                    trade.entryTime().getEpochSecond(),
                    MarkerKind.ENTRY,
                    trade.entryPrice(),
                    trade.entryType(),
                    null,
                    null,
                    "belowBar",
                    ENTRY_COLOR,
                    "arrowUp",
                    String.format(Locale.ROOT, "Buy %s @ %.2f", trade.entryType().wireValue(), trade.entryPrice())
            ));
            if (!trade.isClosed() || trade.exitTime() == null) {
                continue;
            }
            markers.add(new TradeMarkerDto(
                    trade.exitTime().getEpochSecond(),
                    MarkerKind.EXIT,
                    trade.exitPrice(),
                    trade.entryType(),
                    trade.pnlPct(),
                    trade.exitReason(),
                    "aboveBar",
                    trade.pnlPct() > 0.0 ? EXIT_WIN_COLOR : EXIT_LOSS_COLOR,
                    "arrowDown",
                    String.format(Locale.ROOT, "Sell (%s) %.2f%%", trade.exitReason().wireValue(), trade.pnlPct())
            ));
        }
        // the chart widget requires markers in time order
        markers.sort(Comparator.comparingLong(TradeMarkerDto::time));
        return List.copyOf(markers);
    }
}
