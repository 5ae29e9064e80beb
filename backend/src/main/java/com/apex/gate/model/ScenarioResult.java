package com.apex.gate.model;

import java.util.List;

public record ScenarioResult(Scenario scenario, BacktestResult backtest, boolean passed, List<String> violations) {

    public ScenarioResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }
}
