package com.apex.gate.model;

public enum QualityStatus {
    PASS,
    WARNING,
    FAIL
}
