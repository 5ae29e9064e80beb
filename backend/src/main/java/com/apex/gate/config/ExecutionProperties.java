package com.apex.gate.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    @NotBlank
    private String environment = "dev";

    // Bound from ALLOW_EXECUTE; required outside prod before any order is submitted
    private boolean allowExecute = false;

    private boolean verifyFills = true;

    @NotNull
    private Duration fillTimeout = Duration.ofSeconds(30);

    @NotNull
    private Duration pollInterval = Duration.ofSeconds(1);

    public boolean isProduction() {
        return "prod".equalsIgnoreCase(environment) || "production".equalsIgnoreCase(environment);
    }
}
