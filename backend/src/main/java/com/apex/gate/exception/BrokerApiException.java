package com.apex.gate.exception;

public class BrokerApiException extends TradingException {
    private final int statusCode;

    public BrokerApiException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public BrokerApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public BrokerApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
