package com.apex.gate.model;

public record ValidationConfig(
        double trainSplit,
        double validationSplit,
        double holdoutSplit,
        boolean walkForward,
        Integer windowSizeDays,
        boolean expanding,
        int stepSizeDays
) {

    public static ValidationConfig singleBacktest() {
        return new ValidationConfig(0.7, 0.15, 0.15, false, null, true, 1);
    }

    public static ValidationConfig splits(double train, double validation, double holdout) {
        return new ValidationConfig(train, validation, holdout, true, null, true, 1);
    }

    public static ValidationConfig rollingWindows(Integer windowSizeDays, boolean expanding, int stepSizeDays) {
        return new ValidationConfig(0.0, 0.0, 0.0, true, windowSizeDays, expanding, stepSizeDays);
    }

    public double splitTotal() {
        return trainSplit + validationSplit + holdoutSplit;
    }
}
