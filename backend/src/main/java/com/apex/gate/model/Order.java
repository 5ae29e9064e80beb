package com.apex.gate.model;

public record Order(String symbol, OrderSide side, double quantity, OrderType type, Double limitPrice) {

    public static Order market(String symbol, OrderSide side, double quantity) {
        return new Order(symbol, side, quantity, OrderType.MARKET, null);
    }

    public static Order limit(String symbol, OrderSide side, double quantity, double limitPrice) {
        return new Order(symbol, side, quantity, OrderType.LIMIT, limitPrice);
    }
}
