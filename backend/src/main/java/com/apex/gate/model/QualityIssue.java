package com.apex.gate.model;

import java.util.Map;

public record QualityIssue(QualitySeverity severity, String check, String description, Map<String, Object> details) {

    public QualityIssue {
        details = details == null ? Map.of() : Map.copyOf(details);
    }
}
