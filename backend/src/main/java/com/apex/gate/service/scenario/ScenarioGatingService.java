package com.apex.gate.service.scenario;

import com.apex.gate.model.BacktestCosts;
import com.apex.gate.model.BacktestResult;
import com.apex.gate.model.Bar;
import com.apex.gate.model.ComparisonOperator;
import com.apex.gate.model.GatingMetric;
import com.apex.gate.model.GatingResult;
import com.apex.gate.model.GatingRule;
import com.apex.gate.model.Scenario;
import com.apex.gate.model.ScenarioResult;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.service.BacktestEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScenarioGatingService {

    public static final String NO_DATA_VIOLATION = "No data available for scenario date range";

    public static final List<GatingRule> DEFAULT_RULES = List.of(
            new GatingRule(GatingMetric.MAX_DRAWDOWN, ComparisonOperator.LT, 0.5, Set.of("crisis")),
            new GatingRule(GatingMetric.SHARPE, ComparisonOperator.GT, 0.5),
            new GatingRule(GatingMetric.TOTAL_RETURN, ComparisonOperator.GT, -0.2, Set.of("crisis")));

    private final BacktestEngine backtestEngine;
    private final ScenarioRegistry scenarioRegistry;

    public GatingResult evaluate(StrategySpec strategy, Map<String, List<Bar>> barsBySymbol,
                                 BacktestCosts costs, List<GatingRule> rules) {
        return evaluate(strategy, scenarioRegistry.all(), barsBySymbol, costs, rules);
    }

    public GatingResult evaluate(StrategySpec strategy, List<Scenario> scenarios, Map<String, List<Bar>> barsBySymbol,
                                 BacktestCosts costs, List<GatingRule> rules) {
        List<GatingRule> effectiveRules = rules != null ? rules : DEFAULT_RULES;
        List<ScenarioResult> results = new ArrayList<>();
        List<String> blocking = new ArrayList<>();

        for (Scenario scenario : scenarios) {
            ScenarioResult result = evaluateScenario(strategy, scenario, barsBySymbol, costs, effectiveRules);
            results.add(result);
            if (!result.passed()) {
                blocking.addAll(result.violations());
            }
        }
        boolean overallPassed = results.stream().allMatch(ScenarioResult::passed);
        if (!overallPassed) {
            log.warn("Scenario gating failed for {}: {}", strategy.strategyId(), blocking);
        } else {
            log.info("Scenario gating passed for {} across {} scenarios", strategy.strategyId(), results.size());
        }
        return new GatingResult(overallPassed, results, overallPassed, blocking);
    }

    private ScenarioResult evaluateScenario(StrategySpec strategy, Scenario scenario, Map<String, List<Bar>> barsBySymbol,
                                            BacktestCosts costs, List<GatingRule> rules) {
        Map<String, List<Bar>> filtered = filterToScenario(barsBySymbol, scenario);
        if (filtered.isEmpty()) {
            log.debug("No bars for scenario {}", scenario.scenarioId());
            return new ScenarioResult(scenario, null, false, List.of(NO_DATA_VIOLATION));
        }
        BacktestResult backtest = backtestEngine.run(strategy, filtered, costs);
        List<String> violations = new ArrayList<>();
        for (GatingRule rule : rules) {
            if (!rule.appliesTo(scenario)) {
                continue;
            }
            Double value = rule.metric().valueOf(backtest.metrics());
            if (value == null) {
                violations.add(String.format("Scenario %s: %s is not available for rule %s",
                        scenario.name(), rule.metric().wireValue(), rule.describe()));
                continue;
            }
            if (!rule.operator().holds(value, rule.threshold())) {
                violations.add(String.format(Locale.ROOT, "Scenario %s: %s = %.4f violates rule %s",
                        scenario.name(), rule.metric().wireValue(), value, rule.describe()));
            }
        }
        return new ScenarioResult(scenario, backtest, violations.isEmpty(), violations);
    }

    private Map<String, List<Bar>> filterToScenario(Map<String, List<Bar>> barsBySymbol, Scenario scenario) {
        Map<String, List<Bar>> filtered = new LinkedHashMap<>();
        if (barsBySymbol == null) {
            return filtered;
        }
        barsBySymbol.forEach((symbol, bars) -> {
            List<Bar> inRange = bars == null ? List.of() : bars.stream()
                    .filter(bar -> bar.getTimestamp() != null)
                    .filter(bar -> within(bar.getTimestamp().toLocalDate(), scenario))
                    .toList();
            if (!inRange.isEmpty()) {
                filtered.put(symbol, inRange);
            }
        });
        return filtered;
    }

    private static boolean within(LocalDate date, Scenario scenario) {
        return !date.isBefore(scenario.startDate()) && !date.isAfter(scenario.endDate());
    }
}
