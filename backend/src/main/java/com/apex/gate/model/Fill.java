package com.apex.gate.model;

import java.time.Instant;

public record Fill(String orderId, String symbol, OrderSide side, double quantity, double price, Instant timestamp) {
}
