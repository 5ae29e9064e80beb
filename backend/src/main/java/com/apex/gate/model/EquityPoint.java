package com.apex.gate.model;

import java.time.LocalDateTime;

public record EquityPoint(LocalDateTime timestamp, double value) {
}
