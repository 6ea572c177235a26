package org.nowstart.rightside.engine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.nowstart.rightside.engine.core.Bar;
import org.nowstart.rightside.engine.core.IndicatorBar;
import org.nowstart.rightside.engine.core.StrategyParams;
import org.springframework.stereotype.Component;

@Component
public class IndicatorPipeline {

    public List<IndicatorBar> derive(List<Bar> bars, StrategyParams params) {
        if (bars == null || params == null) {
            throw new IllegalArgumentException("bars and params are required");
        }
        validateOrdering(bars);

        int n = bars.size();
        if (n == 0) {
            return List.of();
        }

        double[] high = new double[n];
        double[] low = new double[n];
        double[] close = new double[n];
        double[] vwap = new double[n];
        for (int i = 0; i < n; i++) {
            Bar bar = bars.get(i);
            high[i] = bar.high();
            low[i] = bar.low();
            close[i] = bar.close();
            vwap[i] = bar.vwap();
        }

        double[] atr = simpleAtr(high, low, close, params.atrPeriod());
        double[] ema = exponentialMovingAverage(close, params.emaSpan());
        double[] vwapStd = rollingSampleStd(vwap, params.rollingWindow());
        double[] rollingMax = rollingMax(close, params.rollingWindow());

        List<IndicatorBar> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            double distance = close[i] - vwap[i];
            double dropAtr = atr[i] > 0.0 ? (rollingMax[i] - close[i]) / atr[i] : 0.0;
            out.add(new IndicatorBar(
                    bars.get(i),
                    atr[i],
                    ema[i],
                    (distance / vwap[i]) * 100.0,
                    // deviation of VWAP itself, not of the distance series
                    distance / vwapStd[i],
                    rollingMax[i],
                    dropAtr
            ));
        }
        return List.copyOf(out);
    }

    double[] simpleAtr(double[] high, double[] low, double[] close, int period) {
        int n = close.length;
        double[] atr = new double[n];
        Arrays.fill(atr, Double.NaN);
        if (n < period) {
            return atr;
        }

        double[] tr = new double[n];
        tr[0] = high[0] - low[0];
        for (int i = 1; i < n; i++) {
            double highLow = high[i] - low[i];
            double highPrevClose = Math.abs(high[i] - close[i - 1]);
            double lowPrevClose = Math.abs(low[i] - close[i - 1]);
            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            sum += tr[i];
            if (i >= period) {
                sum -= tr[i - period];
            }
            if (i >= period - 1) {
                atr[i] = sum / period;
            }
        }
        return atr;
    }

    double[] exponentialMovingAverage(double[] values, int span) {
        int n = values.length;
        double[] ema = new double[n];
        if (n == 0) {
            return ema;
        }

        double alpha = 2.0 / (span + 1.0);
        ema[0] = values[0];
        for (int i = 1; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    double[] rollingSampleStd(double[] values, int window) {
        int n = values.length;
        double[] std = new double[n];
        Arrays.fill(std, Double.NaN);
        for (int i = window - 1; i < n; i++) {
            double mean = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                mean += values[j];
            }
            mean /= window;

            double sq = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double d = values[j] - mean;
                sq += d * d;
            }
            std[i] = Math.sqrt(sq / (window - 1));
        }
        return std;
    }

    double[] rollingMax(double[] values, int window) {
        int n = values.length;
        double[] max = new double[n];
        Arrays.fill(max, Double.NaN);
        for (int i = window - 1; i < n; i++) {
            double m = Double.NEGATIVE_INFINITY;
            for (int j = i - window + 1; j <= i; j++) {
                m = Math.max(m, values[j]);
            }
            max[i] = m;
        }
        return max;
    }

    private void validateOrdering(List<Bar> bars) {
        for (int i = 0; i < bars.size(); i++) {
            Bar bar = bars.get(i);
            if (bar == null || bar.timestamp() == null) {
                throw new IllegalArgumentException("bar or timestamp is null at index=" + i);
            }
            if (i > 0 && !bar.timestamp().isAfter(bars.get(i - 1).timestamp())) {
                throw new IllegalArgumentException(
                        "bar timestamps must be strictly increasing, index=" + i + " ts=" + bar.timestamp()
                );
            }
        }
    }
}
