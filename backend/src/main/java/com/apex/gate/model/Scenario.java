package com.apex.gate.model;

import java.time.LocalDate;
import java.util.Set;

public record Scenario(
        String scenarioId,
        String name,
        String description,
        LocalDate startDate,
        LocalDate endDate,
        Set<String> tags
) {

    public Scenario {
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
