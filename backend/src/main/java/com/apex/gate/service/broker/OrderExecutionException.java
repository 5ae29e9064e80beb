package com.apex.gate.service.broker;

import com.apex.gate.exception.TradingException;
import com.apex.gate.model.Fill;

import java.util.List;

/**
 * Order submission stopped before every order was sent. Fills confirmed before the failure are kept.
 */
public class OrderExecutionException extends TradingException {

    private final List<Fill> partialFills;

    public OrderExecutionException(String message, List<Fill> partialFills, Throwable cause) {
        super(message, cause);
        this.partialFills = partialFills == null ? List.of() : List.copyOf(partialFills);
    }

    public List<Fill> getPartialFills() {
        return partialFills;
    }
}
