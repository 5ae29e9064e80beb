package com.apex.gate.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum GatingMetric {
    MAX_DRAWDOWN,
    SHARPE,
    TOTAL_RETURN;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static GatingMetric fromValue(String value) {
        return GatingMetric.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    public Double valueOf(BacktestMetrics metrics) {
        return switch (this) {
            case MAX_DRAWDOWN -> metrics.maxDrawdown();
            case SHARPE -> metrics.sharpe();
            case TOTAL_RETURN -> metrics.totalReturn();
        };
    }
}
