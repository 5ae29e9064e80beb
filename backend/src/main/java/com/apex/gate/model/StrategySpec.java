package com.apex.gate.model;

import java.util.List;

/**
 * A strategy candidate as proposed upstream. Treated as untrusted input everywhere in the pipeline.
 */
public record StrategySpec(
        String strategyId,
        String name,
        String description,
        List<String> universe,
        List<StrategyRule> rules,
        StrategyParams params
) {

    public StrategySpec {
        universe = universe == null ? List.of() : List.copyOf(universe);
        rules = rules == null ? List.of() : List.copyOf(rules);
        params = params == null ? StrategyParams.defaults() : params;
    }

    public List<StrategyRule> rulesOfType(RuleType type) {
        return rules.stream().filter(rule -> rule.type() == type).toList();
    }
}
