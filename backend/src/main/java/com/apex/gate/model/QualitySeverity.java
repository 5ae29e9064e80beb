package com.apex.gate.model;

public enum QualitySeverity {
    ERROR,
    WARNING,
    INFO
}
