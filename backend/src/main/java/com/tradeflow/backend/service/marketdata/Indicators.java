package com.tradeflow.backend.service.marketdata;

import java.util.List;

/**
 * Indicator names carried on a {@link com.tradeflow.backend.model.MarketSnapshot}
 * and the rolling-window math that produces them.
 */
public final class Indicators {

    public static final String CHANGE_5 = "change_5";
    public static final String VOLUME_RATIO = "volume_ratio";
    public static final String MA_20 = "ma_20";
    public static final String MA_50 = "ma_50";
    public static final String RSI_14 = "rsi_14";

    private Indicators() {
    }

    public static double change(List<Double> closes, int lookback) {
        if (closes.size() <= lookback) {
            return 0.0;
        }
        double last = closes.get(closes.size() - 1);
        double base = closes.get(closes.size() - 1 - lookback);
        return base == 0.0 ? 0.0 : (last - base) / base;
    }

    public static double sma(List<Double> values, int period) {
        if (values.isEmpty()) {
            return 0.0;
        }
        int n = Math.min(period, values.size());
        double sum = 0.0;
        for (int i = values.size() - n; i < values.size(); i++) {
            sum += values.get(i);
        }
        return sum / n;
    }

    /**
     * Last value divided by the average of the preceding {@code period} values.
     */
    public static double ratioToAverage(List<Double> values, int period) {
        if (values.size() < 2) {
            return 1.0;
        }
        double last = values.get(values.size() - 1);
        double avg = sma(values.subList(0, values.size() - 1), period);
        return avg == 0.0 ? 1.0 : last / avg;
    }

    /**
     * Wilder-smoothed RSI; 50 when there is not enough history.
     */
    public static double rsi(List<Double> closes, int period) {
        if (closes.size() < period + 1) {
            return 50.0;
        }
        double avgGain = 0.0;
        double avgLoss = 0.0;
        for (int i = 1; i <= period; i++) {
            double change = closes.get(i) - closes.get(i - 1);
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss += Math.abs(change);
            }
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < closes.size(); i++) {
            double change = closes.get(i) - closes.get(i - 1);
            avgGain = ((avgGain * (period - 1)) + Math.max(change, 0.0)) / period;
            avgLoss = ((avgLoss * (period - 1)) + Math.max(-change, 0.0)) / period;
        }

        if (avgLoss == 0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
