package com.apex.gate.model;

import java.time.LocalDateTime;

public record WalkForwardWindow(
        LocalDateTime trainStart,
        LocalDateTime trainEnd,
        LocalDateTime testStart,
        LocalDateTime testEnd
) {
}
