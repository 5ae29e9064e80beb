package com.apex.gate.config;

import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "backtest")
@Data
@Validated
public class BacktestProperties {

    @Positive
    private double initialCapital = 100_000.0;

    @Positive
    private double fixedSizeNotional = 1_000.0;

    private boolean closeOpenPositionsAtEnd = true;
}
