package com.apex.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OrderSide {
    BUY,
    SELL;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OrderSide fromValue(String value) {
        return OrderSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
