package com.apex.gate.model;

import java.util.List;

public record BacktestResult(
        StrategySpec strategy,
        BacktestMetrics metrics,
        List<Trade> tradeLog,
        List<EquityPoint> equityCurve
) {

    public BacktestResult {
        tradeLog = tradeLog == null ? List.of() : List.copyOf(tradeLog);
        equityCurve = equityCurve == null ? List.of() : List.copyOf(equityCurve);
    }

    public List<Double> equityValues() {
        return equityCurve.stream().map(EquityPoint::value).toList();
    }
}
