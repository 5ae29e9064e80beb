package com.apex.gate.model;

public record BacktestMetrics(double sharpe, double maxDrawdown, Double totalReturn) {

    public static BacktestMetrics zero() {
        return new BacktestMetrics(0.0, 0.0, 0.0);
    }
}
