package com.apex.gate.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
@Validated
public class PipelineProperties {

    @Positive
    private double defaultCash = 100_000.0;

    private boolean scenarioGatingEnabled = true;

    private boolean gatingRequiredForExecution = true;
}
