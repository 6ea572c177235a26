package org.nowstart.rightside.service;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.rightside.data.entity.PriceBar;
import org.nowstart.rightside.data.exception.BacktestStageException;
import org.nowstart.rightside.data.type.BacktestStage;
import org.nowstart.rightside.engine.core.Bar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.nowstart.rightside.repository.PriceBarRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BarLoadService {

    private final PriceBarRepository priceBarRepository;

    @Transactional(readOnly = true)
    public List<String> findSymbols() {
        List<String> symbols = priceBarRepository.findDistinctSymbols();
        return symbols == null ? List.of() : symbols;
    }

    /**
     * Loads bars for {@code symbol} between {@code from} and {@code to} (inclusive, either may be null).
     * Store timestamps are exchange wall-clock times and are read in {@code zone}.
     */
    @Transactional(readOnly = true)
    public List<Bar> loadBars(String symbol, Instant from, Instant to, ZoneId zone) {
        String market = normalizeSymbol(symbol);
        List<PriceBar> rows = query(market, toLocal(from, zone), toLocal(to, zone));
        if (rows == null || rows.isEmpty()) {
            log.warn("No bars found in bar store. symbol={}, from={}, to={}", market, from, to);
            return List.of();
        }

        List<Bar> bars = new ArrayList<>(rows.size());
        for (PriceBar row : rows) {
            bars.add(toBar(market, row, zone));
        }
        log.info("Loaded bars. symbol={}, rows={}, first={}, last={}",
                market,
                bars.size(),
                bars.get(0).timestamp(),
                bars.get(bars.size() - 1).timestamp());
        return List.copyOf(bars);
    }

    public List<Bar> filterSession(List<Bar> bars, StrategyParams params) {
        if (!params.sessionFilterEnabled()) {
            return bars;
        }
        LocalTime start = params.sessionStart();
        LocalTime end = params.sessionEnd();
        List<Bar> filtered = bars.stream()
                .filter(bar -> {
                    LocalTime time = bar.timestamp().atZone(params.zoneId()).toLocalTime();
                    return !time.isBefore(start) && !time.isAfter(end);
                })
                .toList();
        log.info("Applied session filter. before={}, after={}, window={}-{}", bars.size(), filtered.size(), start, end);
        return filtered;
    }

    public String normalizeSymbol(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }

    private LocalDateTime toLocal(Instant value, ZoneId zone) {
        return value == null ? null : LocalDateTime.ofInstant(value, zone);
    }

    private List<PriceBar> query(String symbol, LocalDateTime from, LocalDateTime to) {
        if (from != null && to != null) {
            return priceBarRepository.findByIdSymbolAndIdTsBetweenOrderByIdTsAsc(symbol, from, to);
        }
        if (from != null) {
            return priceBarRepository.findByIdSymbolAndIdTsGreaterThanEqualOrderByIdTsAsc(symbol, from);
        }
        if (to != null) {
            return priceBarRepository.findByIdSymbolAndIdTsLessThanEqualOrderByIdTsAsc(symbol, to);
        }
        return priceBarRepository.findByIdSymbolOrderByIdTsAsc(symbol);
    }

    private Bar toBar(String symbol, PriceBar row, ZoneId zone) {
        if (row == null || row.getId() == null || row.getId().ts() == null) {
            throw new BacktestStageException(BacktestStage.LOAD, symbol, "bar row without timestamp");
        }
        LocalDateTime ts = row.getId().ts();
        return new Bar(
                ts.atZone(zone).toInstant(),
                required(symbol, ts, "open_price", row.getOpenPrice()),
                required(symbol, ts, "high_price", row.getHighPrice()),
                required(symbol, ts, "low_price", row.getLowPrice()),
                required(symbol, ts, "close_price", row.getClosePrice()),
                row.getVolume() == null ? 0.0 : row.getVolume().doubleValue(),
                required(symbol, ts, "relative_volume", row.getRelativeVolume()),
                required(symbol, ts, "rsi", row.getRsi()),
                required(symbol, ts, "vwap", row.getVwap())
        );
    }

    private double required(String symbol, LocalDateTime ts, String column, BigDecimal value) {
        if (value == null) {
            throw new BacktestStageException(
                    BacktestStage.LOAD,
                    symbol,
                    "bar store did not supply " + column + " at ts=" + ts
            );
        }
        return value.doubleValue();
    }
}
