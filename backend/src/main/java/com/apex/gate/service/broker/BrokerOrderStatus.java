package com.apex.gate.service.broker;

import com.apex.gate.model.OrderSide;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

public record BrokerOrderStatus(
        String orderId,
        String symbol,
        OrderSide side,
        String status,
        double quantity,
        double filledQuantity,
        Double filledAveragePrice,
        Instant submittedAt,
        Instant filledAt
) {

    private static final Set<String> OPEN_STATES = Set.of("new", "accepted", "pending_new", "partially_filled", "held", "accepted_for_bidding");
    private static final Set<String> DEAD_STATES = Set.of("canceled", "cancelled", "expired", "rejected");

    public boolean isFilled() {
        return "filled".equals(normalized());
    }

    public boolean isTerminalWithoutFill() {
        return DEAD_STATES.contains(normalized());
    }

    public boolean isOpen() {
        return OPEN_STATES.contains(normalized());
    }

    private String normalized() {
        return status == null ? "" : status.toLowerCase(Locale.ROOT);
    }
}
