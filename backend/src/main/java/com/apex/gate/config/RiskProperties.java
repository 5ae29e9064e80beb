package com.apex.gate.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @Positive
    private double maxTradeNotional = 10_000.0;

    @Positive
    private double maxPortfolioExposure = 0.5;

    @Positive
    private double maxPositionPerSymbol = 0.2;

    @Positive
    private double maxDrawdownThreshold = 0.2;

    /**
     * Price assumed when neither a limit price nor a quote is known. This is a placeholder,
     * not a market price, and it decides whether notional limits trip when data is missing.
     */
    @Positive
    private double fallbackReferencePrice = 100.0;

    private List<String> blacklist = new ArrayList<>();

    @Positive
    private double minFraction = 0.01;

    @Positive
    private double maxFraction = 0.05;

    private Scoring scoring = new Scoring();
    private Liquidity liquidity = new Liquidity();
    private ValueAtRisk valueAtRisk = new ValueAtRisk();

    @Data
    public static class Scoring {
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double exposureWeight = 0.6;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double drawdownWeight = 0.4;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double warningScore = 0.5;
    }

    @Data
    public static class Liquidity {
        @DecimalMin("0.0")
        private double minAvgVolume = 100_000.0;

        @Positive
        private double maxVolumeRatio = 0.01;
    }

    @Data
    public static class ValueAtRisk {
        @DecimalMin("0.5")
        @DecimalMax("0.999")
        private double confidenceLevel = 0.95;

        @Min(2)
        private int minReturns = 10;
    }
}
