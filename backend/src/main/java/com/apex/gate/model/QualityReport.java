package com.apex.gate.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accumulated findings of one data quality pass. Issues are added while the checks run; the
 * overall status is derived from the worst severity seen.
 */
@Getter
public class QualityReport {

    private final List<String> checksPerformed = new ArrayList<>();
    private final List<QualityIssue> issues = new ArrayList<>();
    private final List<Map<String, Object>> gaps = new ArrayList<>();
    private final List<Map<String, Object>> outliers = new ArrayList<>();
    private final List<String> validationErrors = new ArrayList<>();
    private final List<String> recommendations = new ArrayList<>();

    public void markPerformed(String check) {
        checksPerformed.add(check);
    }

    public void addIssue(QualitySeverity severity, String check, String description, Map<String, Object> details) {
        issues.add(new QualityIssue(severity, check, description, details));
        if (severity == QualitySeverity.ERROR) {
            validationErrors.add(description);
        }
    }

    public void addGap(Map<String, Object> gap) {
        gaps.add(Collections.unmodifiableMap(new LinkedHashMap<>(gap)));
    }

    public void addOutlier(Map<String, Object> outlier) {
        outliers.add(Collections.unmodifiableMap(new LinkedHashMap<>(outlier)));
    }

    public void addRecommendation(String recommendation) {
        if (!recommendations.contains(recommendation)) {
            recommendations.add(recommendation);
        }
    }

    public QualityStatus getOverallStatus() {
        if (hasSeverity(QualitySeverity.ERROR)) {
            return QualityStatus.FAIL;
        }
        if (hasSeverity(QualitySeverity.WARNING)) {
            return QualityStatus.WARNING;
        }
        return QualityStatus.PASS;
    }

    public boolean hasIssue(String check, QualitySeverity severity) {
        return issues.stream().anyMatch(issue -> issue.check().equals(check) && issue.severity() == severity);
    }

    public boolean hasSeverity(QualitySeverity severity) {
        return issues.stream().anyMatch(issue -> issue.severity() == severity);
    }

    public List<QualityIssue> issuesFor(String check) {
        return issues.stream().filter(issue -> issue.check().equals(check)).toList();
    }
}
