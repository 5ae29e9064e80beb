package com.apex.gate.model;

public record PortfolioPosition(String symbol, double quantity, double averagePrice) {
}
