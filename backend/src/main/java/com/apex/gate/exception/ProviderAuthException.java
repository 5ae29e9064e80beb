package com.apex.gate.exception;

public class ProviderAuthException extends TradingException {
    public ProviderAuthException(String message) {
        super(message);
    }

    public ProviderAuthException(String message, Throwable cause) {
        super(message, cause);
    }
}
