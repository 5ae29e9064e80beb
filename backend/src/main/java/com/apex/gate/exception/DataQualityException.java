package com.apex.gate.exception;

public class DataQualityException extends TradingException {
    public DataQualityException(String message) {
        super(message);
    }

    public DataQualityException(String message, Throwable cause) {
        super(message, cause);
    }
}
