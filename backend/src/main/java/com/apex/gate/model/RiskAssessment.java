package com.apex.gate.model;

import java.util.List;

public record RiskAssessment(
        List<Order> approvedTrades,
        List<String> violations,
        RiskLevel riskLevel,
        double riskScore,
        List<String> warnings,
        Double currentDrawdown,
        boolean drawdownBlocked,
        Double valueAtRisk
) {

    public RiskAssessment {
        approvedTrades = approvedTrades == null ? List.of() : List.copyOf(approvedTrades);
        violations = violations == null ? List.of() : List.copyOf(violations);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static RiskAssessment blocked(List<String> violations) {
        return new RiskAssessment(List.of(), violations, RiskLevel.BLOCK, 1.0, List.of(), null, false, null);
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }
}
