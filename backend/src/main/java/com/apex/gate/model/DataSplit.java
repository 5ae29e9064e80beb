package com.apex.gate.model;

import java.util.List;
import java.util.Map;

public record DataSplit(
        Map<String, List<Bar>> train,
        Map<String, List<Bar>> validation,
        Map<String, List<Bar>> holdout
) {
}
