package com.apex.gate.model;

import java.util.List;

public record WalkForwardResult(
        List<BacktestResult> windows,
        BacktestMetrics aggregateMetrics,
        BacktestMetrics trainMetrics,
        BacktestMetrics validationMetrics,
        BacktestMetrics holdoutMetrics
) {

    public WalkForwardResult {
        windows = windows == null ? List.of() : List.copyOf(windows);
    }
}
