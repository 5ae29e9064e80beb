package com.apex.gate.model;

public enum RiskLevel {
    SAFE,
    WARNING,
    BLOCK
}
