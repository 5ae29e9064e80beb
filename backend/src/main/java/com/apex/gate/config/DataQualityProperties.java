package com.apex.gate.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "data-quality")
@Data
@Validated
public class DataQualityProperties {

    @Min(1)
    private int gapThresholdDays = 3;

    @Positive
    private double outlierThresholdPct = 0.10;

    @Positive
    private double volumeSpikeMultiplier = 10.0;

    @Min(1)
    private int volumeLookbackBars = 5;

    @Min(1)
    private int maxAgeHours = 24;

    // Reject runs whose data fails validation instead of attaching the report
    private boolean strictMode = false;
}
