package com.apex.gate.service.broker;

import com.apex.gate.config.AlpacaProperties;
import com.apex.gate.exception.BrokerApiException;
import com.apex.gate.exception.BrokerRateLimitException;
import com.apex.gate.exception.ProviderAuthException;
import com.apex.gate.exception.ProviderTransientException;
import com.apex.gate.service.MetricsService;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

@Slf4j
@Component
@RequiredArgsConstructor
public class AlpacaHttpClient {

    static final String KEY_HEADER = "APCA-API-KEY-ID";
    static final String SECRET_HEADER = "APCA-API-SECRET-KEY";

    private final RestTemplate alpacaRestTemplate;
    private final Retry alpacaRetry;
    private final CircuitBreaker alpacaCircuitBreaker;
    private final RateLimiter alpacaRateLimiter;
    private final AlpacaProperties alpacaProperties;
    private final MetricsService metricsService;

    public String get(String path) {
        return execute(HttpMethod.GET, path, null);
    }

    public String post(String path, String body) {
        return execute(HttpMethod.POST, path, body);
    }

    public String delete(String path) {
        return execute(HttpMethod.DELETE, path, null);
    }

    /**
     * Single attempt without retry, for health probes that must answer quickly.
     */
    public String probe(String path) {
        return doRequest(HttpMethod.GET, path, null);
    }

    public CircuitBreaker.State circuitState() {
        return alpacaCircuitBreaker.getState();
    }

    private String execute(HttpMethod method, String path, String body) {
        long started = System.nanoTime();
        boolean success = false;
        Supplier<String> supplier = () -> doRequest(method, path, body);
        try {
            Supplier<String> decorated = Retry.decorateSupplier(alpacaRetry, supplier);
            decorated = CircuitBreaker.decorateSupplier(alpacaCircuitBreaker, decorated);
            decorated = RateLimiter.decorateSupplier(alpacaRateLimiter, decorated);
            String response = decorated.get();
            success = true;
            return response;
        } catch (CallNotPermittedException e) {
            recordFailure(method, path, "CIRCUIT_OPEN", e);
            throw new ProviderTransientException("Alpaca circuit breaker open", e);
        } catch (RequestNotPermitted e) {
            recordFailure(method, path, "RATE_LIMIT_LOCAL", e);
            throw new BrokerRateLimitException("Alpaca request rate limit reached locally", e);
        } catch (ProviderAuthException | BrokerApiException | ProviderTransientException e) {
            recordFailure(method, path, e.getClass().getSimpleName(), e);
            throw e;
        } finally {
            metricsService.recordBrokerCall("alpaca", method.name(), success, Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private String doRequest(HttpMethod method, String path, String body) {
        String url = alpacaProperties.getBaseUrl() + path;
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.set(KEY_HEADER, alpacaProperties.getApiKey() == null ? "" : alpacaProperties.getApiKey());
            headers.set(SECRET_HEADER, alpacaProperties.getApiSecret() == null ? "" : alpacaProperties.getApiSecret());
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            if (method == HttpMethod.POST) {
                headers.setContentType(MediaType.APPLICATION_JSON);
            }
            ResponseEntity<String> response = alpacaRestTemplate.exchange(url, method, new HttpEntity<>(body, headers), String.class);
            return response.getBody();
        } catch (HttpClientErrorException.TooManyRequests e) {
            log.warn("Alpaca rate limit 429 for {} {}", method, path);
            throw new BrokerRateLimitException("Alpaca rate limit", e);
        } catch (HttpClientErrorException.Unauthorized | HttpClientErrorException.Forbidden e) {
            throw new ProviderAuthException("Alpaca rejected the API credentials (" + e.getStatusCode().value()
                    + "). Check alpaca.api-key and alpaca.api-secret (ALPACA_API_KEY / ALPACA_API_SECRET).", e);
        } catch (HttpClientErrorException e) {
            throw new BrokerApiException("Alpaca API error (" + e.getStatusCode().value() + "): " + e.getResponseBodyAsString(),
                    e.getStatusCode().value(), e);
        } catch (HttpServerErrorException e) {
            throw new ProviderTransientException("Alpaca server error (" + e.getStatusCode().value() + "): "
                    + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            log.warn("Alpaca network error for {} {}: {}", method, path, e.getMessage());
            throw new ProviderTransientException("Alpaca network error: " + e.getMessage(), e);
        }
    }

    private void recordFailure(HttpMethod method, String path, String reason, Exception e) {
        metricsService.recordBrokerError();
        log.warn("Alpaca request failed method={} path={} reason={} message={}", method, path, reason, e.getMessage());
    }
}
