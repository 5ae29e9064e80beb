package com.apex.gate.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

public record PortfolioState(double cash, List<PortfolioPosition> positions) {

    public PortfolioState {
        positions = positions == null ? List.of() : List.copyOf(positions);
    }

    public static PortfolioState cashOnly(double cash) {
        return new PortfolioState(cash, List.of());
    }

    public Optional<PortfolioPosition> position(String symbol) {
        return positions.stream().filter(position -> position.symbol().equals(symbol)).findFirst();
    }

    public double quantityOf(String symbol) {
        return position(symbol).map(PortfolioPosition::quantity).orElse(0.0);
    }

    /**
     * Marks each position at its latest price, falling back to the average entry price when no quote is known.
     */
    public double markToMarket(String symbol, Map<String, Double> latestPrices) {
        return position(symbol)
                .map(position -> position.quantity() * markPrice(position, latestPrices))
                .orElse(0.0);
    }

    public double grossPositionValue(Map<String, Double> latestPrices) {
        return positions.stream()
                .mapToDouble(position -> Math.abs(position.quantity() * markPrice(position, latestPrices)))
                .sum();
    }

    public double totalValue(Map<String, Double> latestPrices) {
        double value = cash;
        for (PortfolioPosition position : positions) {
            value += position.quantity() * markPrice(position, latestPrices);
        }
        return value;
    }

    private static double markPrice(PortfolioPosition position, Map<String, Double> latestPrices) {
        Double price = latestPrices == null ? null : latestPrices.get(position.symbol());
        return price != null ? price : position.averagePrice();
    }
}
