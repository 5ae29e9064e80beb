package com.apex.gate.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "validation")
@Data
@Validated
public class ValidationProperties {

    @Min(1)
    private int minTrainDays = 30;

    @Min(1)
    private int minTestDays = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double initialTrainFraction = 0.70;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double testFraction = 0.15;

    @Positive
    private double splitTolerance = 0.01;
}
