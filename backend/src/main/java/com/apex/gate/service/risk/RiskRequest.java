package com.apex.gate.service.risk;

import com.apex.gate.model.Order;
import com.apex.gate.model.PortfolioState;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inputs of one risk assessment. {@code equityCurve} and {@code averageDailyVolumes} are optional.
 */
public record RiskRequest(
        PortfolioState portfolio,
        List<Order> proposedOrders,
        Map<String, Double> latestPrices,
        List<Double> equityCurve,
        Map<String, Double> averageDailyVolumes
) {

    public RiskRequest {
        proposedOrders = proposedOrders == null ? List.of() : List.copyOf(proposedOrders);
        latestPrices = knownValues(latestPrices);
        averageDailyVolumes = knownValues(averageDailyVolumes);
    }

    // Symbols quoted as null are treated as unknown
    private static Map<String, Double> knownValues(Map<String, Double> values) {
        if (values == null) {
            return Map.of();
        }
        Map<String, Double> known = new HashMap<>();
        values.forEach((symbol, value) -> {
            if (symbol != null && value != null) {
                known.put(symbol, value);
            }
        });
        return Collections.unmodifiableMap(known);
    }
}
