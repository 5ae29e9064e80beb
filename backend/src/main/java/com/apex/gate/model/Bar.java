package com.apex.gate.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One OHLCV observation. Fields are boxed so that a feed with missing values can still be
 * materialized and reported on by the data quality checks.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Bar {
    private LocalDateTime timestamp;
    private Double open;
    private Double high;
    private Double low;
    private Double close;
    private Long volume;

    public boolean isComplete() {
        return timestamp != null && open != null && high != null && low != null && close != null && volume != null;
    }
}
