package com.apex.gate.service.indicator;

import java.util.Arrays;

/**
 * Series-in, series-out technical indicators. Positions where the indicator is not yet defined
 * (not enough history) hold {@link Double#NaN}.
 */
public final class Indicators {

    private Indicators() {
    }

    public static double[] sma(double[] values, int window) {
        double[] result = nanSeries(values.length);
        if (window <= 0 || values.length < window) {
            return result;
        }
        double sum = 0.0;
        for (int i = 0; i < values.length; i++) {
            sum += values[i];
            if (i >= window) {
                sum -= values[i - window];
            }
            if (i >= window - 1) {
                result[i] = sum / window;
            }
        }
        return result;
    }

    public static double[] ema(double[] values, int window) {
        double[] result = nanSeries(values.length);
        if (window <= 0 || values.length < window) {
            return result;
        }
        double seed = 0.0;
        for (int i = 0; i < window; i++) {
            seed += values[i];
        }
        double alpha = 2.0 / (window + 1);
        double ema = seed / window;
        result[window - 1] = ema;
        for (int i = window; i < values.length; i++) {
            ema = alpha * values[i] + (1 - alpha) * ema;
            result[i] = ema;
        }
        return result;
    }

    public static double[] returns(double[] values) {
        double[] result = nanSeries(values.length);
        for (int i = 1; i < values.length; i++) {
            double previous = values[i - 1];
            if (previous != 0.0) {
                result[i] = (values[i] - previous) / previous;
            }
        }
        return result;
    }

    public static double[] momentum(double[] values, int lookback) {
        double[] result = nanSeries(values.length);
        if (lookback <= 0) {
            return result;
        }
        for (int i = lookback; i < values.length; i++) {
            double past = values[i - lookback];
            if (past > 0) {
                result[i] = (values[i] - past) / past;
            }
        }
        return result;
    }

    /**
     * Rolling z-score using the population standard deviation. A flat window scores 0.
     */
    public static double[] zscore(double[] values, int window) {
        double[] result = nanSeries(values.length);
        if (window <= 1) {
            return result;
        }
        for (int i = window - 1; i < values.length; i++) {
            double sum = 0.0;
            boolean defined = true;
            for (int j = i - window + 1; j <= i; j++) {
                if (Double.isNaN(values[j])) {
                    defined = false;
                    break;
                }
                sum += values[j];
            }
            if (!defined) {
                continue;
            }
            double mean = sum / window;
            double variance = 0.0;
            for (int j = i - window + 1; j <= i; j++) {
                double diff = values[j] - mean;
                variance += diff * diff;
            }
            double std = Math.sqrt(variance / window);
            result[i] = std == 0.0 ? 0.0 : (values[i] - mean) / std;
        }
        return result;
    }

    private static double[] nanSeries(int length) {
        double[] series = new double[length];
        Arrays.fill(series, Double.NaN);
        return series;
    }
}
