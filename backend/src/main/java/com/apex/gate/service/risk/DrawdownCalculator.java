package com.apex.gate.service.risk;

import java.util.Arrays;
import java.util.List;

public final class DrawdownCalculator {

    private DrawdownCalculator() {
    }

    /**
     * Decline of the last value from the highest value seen in the curve.
     */
    public static double current(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double peak = values.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double last = values.get(values.size() - 1);
        return peak > 0 ? Math.max(0.0, (peak - last) / peak) : 0.0;
    }

    public static double max(List<Double> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double runningPeak = values.get(0);
        double maxDrawdown = 0.0;
        for (double value : values) {
            runningPeak = Math.max(runningPeak, value);
            if (runningPeak > 0) {
                maxDrawdown = Math.max(maxDrawdown, (runningPeak - value) / runningPeak);
            }
        }
        return maxDrawdown;
    }

    /**
     * Historical-simulation value at risk of the curve's period returns, in currency units.
     * Returns 0 when fewer than {@code minReturns} returns are available.
     */
    public static double valueAtRisk(List<Double> values, double confidenceLevel, double portfolioValue, int minReturns) {
        if (values == null || values.size() - 1 < minReturns) {
            return 0.0;
        }
        double[] returns = new double[values.size() - 1];
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1);
            returns[i - 1] = previous > 0 ? (values.get(i) - previous) / previous : 0.0;
        }
        Arrays.sort(returns);
        int index = (int) (returns.length * (1.0 - confidenceLevel));
        index = Math.max(0, Math.min(index, returns.length - 1));
        return Math.abs(Math.min(0.0, returns[index])) * portfolioValue;
    }
}
