package com.apex.gate.model;

public record StrategyParams(PositionSizing positionSizing, Double fraction, String timeframe) {

    public static final double DEFAULT_FRACTION = 0.02;
    public static final String DEFAULT_TIMEFRAME = "1d";

    public StrategyParams {
        positionSizing = positionSizing == null ? PositionSizing.FIXED_FRACTION : positionSizing;
        fraction = fraction == null ? DEFAULT_FRACTION : fraction;
        timeframe = timeframe == null || timeframe.isBlank() ? DEFAULT_TIMEFRAME : timeframe;
    }

    public static StrategyParams defaults() {
        return new StrategyParams(PositionSizing.FIXED_FRACTION, DEFAULT_FRACTION, DEFAULT_TIMEFRAME);
    }
}
