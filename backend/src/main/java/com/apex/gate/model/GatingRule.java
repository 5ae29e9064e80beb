package com.apex.gate.model;

import java.util.Collections;
import java.util.Set;

/**
 * Pass condition for one metric. A rule without tags applies to every scenario.
 */
public record GatingRule(GatingMetric metric, ComparisonOperator operator, double threshold, Set<String> scenarioTags) {

    public GatingRule {
        scenarioTags = scenarioTags == null ? Set.of() : Set.copyOf(scenarioTags);
    }

    public GatingRule(GatingMetric metric, ComparisonOperator operator, double threshold) {
        this(metric, operator, threshold, Set.of());
    }

    public boolean appliesTo(Scenario scenario) {
        return scenarioTags.isEmpty() || !Collections.disjoint(scenarioTags, scenario.tags());
    }

    public String describe() {
        return metric.wireValue() + " " + operator.symbol() + " " + threshold;
    }
}
