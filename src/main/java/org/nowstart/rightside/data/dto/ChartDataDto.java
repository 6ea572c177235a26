package org.nowstart.rightside.data.dto;

import java.util.List;
import org.nowstart.rightside.engine.core.PerformanceMetrics;
import org.nowstart.rightside.engine.core.Trade;

public record ChartDataDto(
        String symbol,
        List<CandlePointDto> ohlc,
        List<VolumePointDto> volume,
        List<LinePointDto> vwap,
        List<LinePointDto> ema,
        List<TradeMarkerDto> markers,
        List<Trade> trades,
        PerformanceMetrics metrics
) {
}
