package org.nowstart.rightside.data.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.Immutable;

import java.io.Serializable;
import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Read-only view of the external 2-minute bar store. {@code vwap}, {@code rsi} and
 * {@code relativeVolume} are filled by the upstream loader.
 *
 * <p>{@code timestamp} is a naive exchange wall-clock time ({@code timestamp without time zone});
 * it only becomes an instant once paired with the exchange zone.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@Entity
@Immutable
@Table(name = "trading_data_2m")
public class PriceBar {

    @EmbeddedId
    private PriceBarKey id;

    private BigDecimal openPrice;

    private BigDecimal highPrice;

    private BigDecimal lowPrice;

    private BigDecimal closePrice;

    private BigDecimal volume;

    private BigDecimal vwap;

    private BigDecimal rsi;

    private BigDecimal relativeVolume;

    public static PriceBar of(
            String symbol,
            LocalDateTime ts,
            BigDecimal openPrice,
            BigDecimal highPrice,
            BigDecimal lowPrice,
            BigDecimal closePrice,
            BigDecimal volume,
            BigDecimal vwap,
            BigDecimal rsi,
            BigDecimal relativeVolume
    ) {
        PriceBar bar = new PriceBar();
        bar.id = new PriceBarKey(symbol, ts);
        bar.openPrice = openPrice;
        bar.highPrice = highPrice;
        bar.lowPrice = lowPrice;
        bar.closePrice = closePrice;
        bar.volume = volume;
        bar.vwap = vwap;
        bar.rsi = rsi;
        bar.relativeVolume = relativeVolume;
        return bar;
    }

    @Embeddable
    public record PriceBarKey(String symbol, @Column(name = "timestamp") LocalDateTime ts) implements Serializable {}
}
