package com.apex.gate.service.broker;

import java.util.List;

public record CancelAllResult(int cancelledCount, int totalOrders, List<String> errors, String message) {

    public CancelAllResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
