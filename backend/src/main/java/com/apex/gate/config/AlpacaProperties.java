package com.apex.gate.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "alpaca")
@Data
@Validated
public class AlpacaProperties {

    @NotBlank
    private String baseUrl = "https://paper-api.alpaca.markets";

    private String apiKey;

    private String apiSecret;

    private String timeInForce = "day";

    private Http http = new Http();

    @Data
    public static class Http {
        @Min(1)
        private int connectTimeoutMs = 10_000;

        @Min(1)
        private int readTimeoutMs = 10_000;
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }
}
