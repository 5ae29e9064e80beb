package com.apex.gate.exception;

public class ConfigurationException extends TradingException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
