package com.apex.gate.model;

public record BacktestCosts(double commission, double slippagePct) {

    public static final double DEFAULT_COMMISSION = 0.001;
    public static final double DEFAULT_SLIPPAGE_PCT = 0.0005;

    public static BacktestCosts defaults() {
        return new BacktestCosts(DEFAULT_COMMISSION, DEFAULT_SLIPPAGE_PCT);
    }

    public static BacktestCosts none() {
        return new BacktestCosts(0.0, 0.0);
    }
}
