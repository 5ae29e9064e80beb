package com.apex.gate.exception;

public class ProviderTransientException extends TradingException {
    public ProviderTransientException(String message) {
        super(message);
    }

    public ProviderTransientException(String message, Throwable cause) {
        super(message, cause);
    }
}
