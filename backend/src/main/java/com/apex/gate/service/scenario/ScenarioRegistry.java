package com.apex.gate.service.scenario;

import com.apex.gate.model.Scenario;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Hand-curated historical stress windows. Read-only at runtime.
 */
@Component
public class ScenarioRegistry {

    public static final String CRISIS_2008 = "2008_crisis";
    public static final String COVID_2020 = "2020_covid";
    public static final String BEAR_2022 = "2022_bear";

    private final Map<String, Scenario> scenarios = new LinkedHashMap<>();

    public ScenarioRegistry() {
        register(new Scenario(CRISIS_2008, "2008 Financial Crisis",
                "Global financial crisis and the collapse of Lehman Brothers",
                LocalDate.of(2007, 10, 1), LocalDate.of(2009, 3, 31),
                Set.of("crisis", "volatility", "bear_market", "financial")));
        register(new Scenario(COVID_2020, "2020 COVID Crash",
                "Pandemic sell-off and the rapid recovery that followed",
                LocalDate.of(2020, 2, 1), LocalDate.of(2020, 6, 30),
                Set.of("crisis", "volatility", "pandemic", "bear_market")));
        register(new Scenario(BEAR_2022, "2022 Bear Market",
                "Rate hikes and persistent inflation",
                LocalDate.of(2022, 1, 1), LocalDate.of(2022, 12, 31),
                Set.of("bear_market", "volatility", "inflation")));
    }

    private void register(Scenario scenario) {
        scenarios.put(scenario.scenarioId(), scenario);
    }

    public Optional<Scenario> get(String scenarioId) {
        return Optional.ofNullable(scenarios.get(scenarioId));
    }

    public List<Scenario> all() {
        return List.copyOf(scenarios.values());
    }

    /**
     * Scenarios carrying every one of the requested tags. No tags returns the whole registry.
     */
    public List<Scenario> list(Collection<String> tags) {
        if (tags == null || tags.isEmpty()) {
            return all();
        }
        return scenarios.values().stream()
                .filter(scenario -> scenario.tags().containsAll(tags))
                .toList();
    }
}
