package com.apex.gate.exception;

public class KillSwitchActiveException extends TradingException {
    public KillSwitchActiveException(String message) {
        super(message);
    }

    public KillSwitchActiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
