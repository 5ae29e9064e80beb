package com.apex.gate.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record StrategyRule(RuleType type, String indicator, Map<String, Object> params) {

    public StrategyRule {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public double doubleParam(String key, double defaultValue) {
        Object value = params.get(key);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException ignored) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    public int intParam(String key, int defaultValue) {
        return (int) Math.round(doubleParam(key, defaultValue));
    }

    public String stringParam(String key, String defaultValue) {
        Object value = params.get(key);
        return value == null ? defaultValue : value.toString().trim();
    }

    public boolean booleanParam(String key, boolean defaultValue) {
        Object value = params.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return value == null ? defaultValue : Boolean.parseBoolean(value.toString().trim());
    }
}
