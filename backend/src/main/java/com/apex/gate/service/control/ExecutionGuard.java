package com.apex.gate.service.control;

import com.apex.gate.config.ExecutionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Outside production, order submission needs {@code execution.allow-execute=true}.
 */
@Component
@RequiredArgsConstructor
public class ExecutionGuard {

    private final ExecutionProperties executionProperties;

    /**
     * @return the reason submission is blocked, or empty when it may proceed
     */
    public Optional<String> blockedReason() {
        if (executionProperties.isProduction() || executionProperties.isAllowExecute()) {
            return Optional.empty();
        }
        return Optional.of("Execution disabled in environment '" + executionProperties.getEnvironment()
                + "': set ALLOW_EXECUTE=true (execution.allow-execute) to submit orders");
    }
}
