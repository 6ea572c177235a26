package org.nowstart.rightside.engine.core;

import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Immutable parameter set shared by every engine stage of one backtest run.
 *
 * @param rvolThreshold          capitulation: relative volume must exceed this
 * @param vwapDistanceThreshold  capitulation: close must sit more than this percent below VWAP
 * @param atrDropMultiplier      capitulation: drop from the rolling high must exceed this many ATRs
 * @param rsiThreshold           capitulation: RSI must be below this
 * @param atrPeriod              ATR rolling window
 * @param emaSpan                EMA span used by the v-turn reclaim check
 * @param rollingWindow          window of the rolling close high and of the VWAP deviation
 * @param pivotWindow            half-width of the pivot window over capitulation positions
 * @param pivotSearchBars        bars scanned (from the capitulation bar) for the V-bottom low
 * @param triggerSearchBars      bars scanned after the pivot for an entry
 * @param vTurnRelativeVolume    v-turn: relative volume must exceed this
 * @param vTurnMaxStopDistance   v-turn: max fraction between close and pivot low
 * @param higherLowLookback      higher-low: bars in the structure window
 * @param higherLowBuffer        higher-low: fraction the window low must clear the pivot by
 * @param entryCutoffHour        no capitulation bar at or after this hour starts a setup
 * @param exitHour               open trades are closed at the first bar at or after this hour
 * @param maxHoldBars            look-ahead slice length, entry bar included
 * @param fallbackStopPct        stop distance used when a trigger carries no stop
 * @param minRiskPct             floor applied to a non-positive entry risk
 * @param zoneId                 exchange time zone for hours and calendar dates
 * @param sessionFilterEnabled   keep only bars inside the session window
 * @param sessionStart           first session time, inclusive
 * @param sessionEnd             last session time, inclusive
 */
public record StrategyParams(
        double rvolThreshold,
        double vwapDistanceThreshold,
        double atrDropMultiplier,
        double rsiThreshold,
        int atrPeriod,
        int emaSpan,
        int rollingWindow,
        int pivotWindow,
        int pivotSearchBars,
        int triggerSearchBars,
        double vTurnRelativeVolume,
        double vTurnMaxStopDistance,
        int higherLowLookback,
        double higherLowBuffer,
        int entryCutoffHour,
        int exitHour,
        int maxHoldBars,
        double fallbackStopPct,
        double minRiskPct,
        ZoneId zoneId,
        boolean sessionFilterEnabled,
        LocalTime sessionStart,
        LocalTime sessionEnd
) {

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/Chicago");

    public StrategyParams {
        if (atrPeriod <= 0 || emaSpan <= 0 || rollingWindow <= 1) {
            throw new IllegalArgumentException("atr-period, ema-span must be > 0 and rolling-window > 1");
        }
        if (pivotWindow <= 0 || pivotSearchBars <= 0 || triggerSearchBars <= 1 || higherLowLookback <= 0) {
            throw new IllegalArgumentException("scan windows must be > 0");
        }
        if (maxHoldBars <= 0) {
            throw new IllegalArgumentException("max-hold-bars must be > 0");
        }
        if (fallbackStopPct <= 0.0 || fallbackStopPct >= 1.0 || minRiskPct <= 0.0 || minRiskPct >= 1.0) {
            throw new IllegalArgumentException("fallback-stop-pct and min-risk-pct must be in (0, 1)");
        }
        if (zoneId == null) {
            throw new IllegalArgumentException("zone-id is required");
        }
        if (sessionFilterEnabled && (sessionStart == null || sessionEnd == null || sessionEnd.isBefore(sessionStart))) {
            throw new IllegalArgumentException("session-start must be <= session-end");
        }
    }

    public static StrategyParams defaults() {
        return new StrategyParams(
                1.5,
                0.5,
                3.0,
                35.0,
                14,
                9,
                20,
                10,
                20,
                40,
                1.5,
                0.025,
                5,
                0.0005,
                15,
                15,
                250,
                0.02,
                0.01,
                DEFAULT_ZONE,
                false,
                LocalTime.of(8, 30),
                LocalTime.of(15, 0)
        );
    }

    public StrategyParams withCapitulationThresholds(double rvol, double vwapDistance, double atrDrop) {
        return new StrategyParams(
                rvol,
                vwapDistance,
                atrDrop,
                rsiThreshold,
                atrPeriod,
                emaSpan,
                rollingWindow,
                pivotWindow,
                pivotSearchBars,
                triggerSearchBars,
                vTurnRelativeVolume,
                vTurnMaxStopDistance,
                higherLowLookback,
                higherLowBuffer,
                entryCutoffHour,
                exitHour,
                maxHoldBars,
                fallbackStopPct,
                minRiskPct,
                zoneId,
                sessionFilterEnabled,
                sessionStart,
                sessionEnd
        );
    }
}
