package com.apex.gate.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "broker")
@Data
@Validated
public class BrokerProperties {

    @NotBlank
    private String primary = "alpaca";

    private boolean failoverEnabled = true;

    private List<String> failover = new ArrayList<>(List.of("paper"));

    @NotNull
    private Duration healthCheckTimeout = Duration.ofSeconds(5);

    private Retry retry = new Retry();
    private CircuitBreaker circuitBreaker = new CircuitBreaker();
    private RateLimit rateLimit = new RateLimit();
    private Paper paper = new Paper();

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull
        private Duration baseDelay = Duration.ofSeconds(2);

        @Positive
        private double multiplier = 2.0;

        @NotNull
        private Duration maxDelay = Duration.ofSeconds(10);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitter = 0.2;
    }

    @Data
    public static class CircuitBreaker {
        @Positive
        private float failureRateThreshold = 50.0f;

        @Min(1)
        private int slidingWindowSize = 20;

        @Min(1)
        private int minimumNumberOfCalls = 10;

        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(30);
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int limitPerSecond = 3;

        @NotNull
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Paper {
        @Positive
        private double startingCash = 100_000.0;
    }
}
