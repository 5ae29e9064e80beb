package com.apex.gate.exception;

public class NoBrokerAvailableException extends TradingException {
    public NoBrokerAvailableException(String message) {
        super(message);
    }

    public NoBrokerAvailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
