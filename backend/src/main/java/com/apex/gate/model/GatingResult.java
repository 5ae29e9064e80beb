package com.apex.gate.model;

import java.util.List;

public record GatingResult(
        boolean passed,
        List<ScenarioResult> scenarioResults,
        boolean overallPassed,
        List<String> blockingViolations
) {

    public GatingResult {
        scenarioResults = scenarioResults == null ? List.of() : List.copyOf(scenarioResults);
        blockingViolations = blockingViolations == null ? List.of() : List.copyOf(blockingViolations);
    }
}
