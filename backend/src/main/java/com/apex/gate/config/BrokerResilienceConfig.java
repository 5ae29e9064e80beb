package com.apex.gate.config;

import com.apex.gate.exception.BrokerApiException;
import com.apex.gate.exception.ProviderAuthException;
import com.apex.gate.exception.ProviderTransientException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class BrokerResilienceConfig {

    @Bean
    public CircuitBreaker alpacaCircuitBreaker(BrokerProperties brokerProperties) {
        return circuitBreaker("alpaca", brokerProperties.getCircuitBreaker());
    }

    @Bean
    public RateLimiter alpacaRateLimiter(BrokerProperties brokerProperties) {
        return rateLimiter("alpaca", brokerProperties.getRateLimit());
    }

    @Bean
    public Retry alpacaRetry(BrokerProperties brokerProperties) {
        return retry("alpaca", brokerProperties.getRetry());
    }

    /**
     * Exponential backoff with jitter, retrying only transient provider failures (429, 5xx, network).
     * Authentication and other client errors fail on the first attempt.
     */
    public static Retry retry(String name, BrokerProperties.Retry settings) {
        IntervalFunction intervalFunction = IntervalFunction.ofExponentialRandomBackoff(
                settings.getBaseDelay(),
                settings.getMultiplier(),
                settings.getJitter(),
                settings.getMaxDelay()
        );
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxAttempts())
                .intervalFunction(intervalFunction)
                .retryExceptions(ProviderTransientException.class)
                .ignoreExceptions(ProviderAuthException.class, BrokerApiException.class)
                .build();
        return Retry.of(name, config);
    }

    public static CircuitBreaker circuitBreaker(String name, BrokerProperties.CircuitBreaker settings) {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitDurationInOpenState(settings.getWaitDurationInOpenState())
                .slidingWindowSize(settings.getSlidingWindowSize())
                .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
                .ignoreExceptions(ProviderAuthException.class, BrokerApiException.class)
                .build();
        return CircuitBreaker.of(name, config);
    }

    public static RateLimiter rateLimiter(String name, BrokerProperties.RateLimit settings) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(settings.getLimitPerSecond())
                .timeoutDuration(settings.getTimeout())
                .build();
        return RateLimiter.of(name, config);
    }
}
