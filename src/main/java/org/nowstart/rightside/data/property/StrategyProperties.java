package org.nowstart.rightside.data.property;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.LocalTime;
import java.time.ZoneId;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "rightside.strategy")
public record StrategyProperties(
        // capitulation: minimum relative volume (exclusive)
        @DecimalMin("0") @DefaultValue("1.5") BigDecimal rvolThreshold,
        // capitulation: percent below VWAP (0.5 = close at least 0.5% under VWAP)
        @DecimalMin("0") @DefaultValue("0.5") BigDecimal vwapDistanceThreshold,
        // capitulation: drop from 20-bar closing high in ATR units
        @DecimalMin("0") @DefaultValue("3.0") BigDecimal atrDropMultiplier,
        // capitulation: RSI oversold level
        @DecimalMin("0") @DecimalMax("100") @DefaultValue("35") BigDecimal rsiThreshold,
        @Positive @DefaultValue("14") int atrPeriod,
        @Positive @DefaultValue("9") int emaSpan,
        @Min(2) @DefaultValue("20") int rollingWindow,
        @Positive @DefaultValue("10") int pivotWindow,
        @Positive @DefaultValue("20") int pivotSearchBars,
        @Min(2) @DefaultValue("40") int triggerSearchBars,
        @DecimalMin("0") @DefaultValue("1.5") BigDecimal vTurnRelativeVolume,
        // v-turn: max distance from close down to the pivot low (0.025 = 2.5%)
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("0.025") BigDecimal vTurnMaxStopDistance,
        @Positive @DefaultValue("5") int higherLowLookback,
        @DecimalMin("0") @DefaultValue("0.0005") BigDecimal higherLowBuffer,
        @Min(0) @Max(23) @DefaultValue("15") int entryCutoffHour,
        @Min(0) @Max(23) @DefaultValue("15") int exitHour,
        @Positive @DefaultValue("250") int maxHoldBars,
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "1", inclusive = false) @DefaultValue("0.02") BigDecimal fallbackStopPct,
        @DecimalMin(value = "0", inclusive = false) @DecimalMax(value = "1", inclusive = false) @DefaultValue("0.01") BigDecimal minRiskPct,
        // bar timestamps are interpreted in this zone for hour and date checks
        @NotBlank @DefaultValue("America/Chicago") String zoneId,
        @DefaultValue("false") boolean sessionFilterEnabled,
        @Pattern(regexp = "\\d{2}:\\d{2}") @DefaultValue("08:30") String sessionStart,
        @Pattern(regexp = "\\d{2}:\\d{2}") @DefaultValue("15:00") String sessionEnd
) {

    public StrategyParams toStrategyParams() {
        return new StrategyParams(
                rvolThreshold.doubleValue(),
                vwapDistanceThreshold.doubleValue(),
                atrDropMultiplier.doubleValue(),
                rsiThreshold.doubleValue(),
                atrPeriod,
                emaSpan,
                rollingWindow,
                pivotWindow,
                pivotSearchBars,
                triggerSearchBars,
                vTurnRelativeVolume.doubleValue(),
                vTurnMaxStopDistance.doubleValue(),
                higherLowLookback,
                higherLowBuffer.doubleValue(),
                entryCutoffHour,
                exitHour,
                maxHoldBars,
                fallbackStopPct.doubleValue(),
                minRiskPct.doubleValue(),
                ZoneId.of(zoneId.trim()),
                sessionFilterEnabled,
                LocalTime.parse(sessionStart),
                LocalTime.parse(sessionEnd)
        );
    }
}
