package com.apex.gate.model;

import java.time.LocalDateTime;

public record Trade(LocalDateTime timestamp, String symbol, OrderSide side, double quantity, double price) {
}
