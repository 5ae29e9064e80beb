package com.apex.gate.exception;

public class BrokerRateLimitException extends ProviderTransientException {
    public BrokerRateLimitException(String message) {
        super(message);
    }

    public BrokerRateLimitException(String message, Throwable cause) {
        super(message, cause);
    }
}
