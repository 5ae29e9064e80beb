package com.apex.gate.service.broker;

import com.apex.gate.config.BrokerProperties;
import com.apex.gate.exception.NoBrokerAvailableException;
import com.apex.gate.service.MetricsService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Picks a healthy broker, preferring the cached one, then the primary, then each failover in order.
 * <p>
 * State moves NO_BROKER to SELECTING to ACTIVE, and back to SELECTING whenever the active broker fails
 * a health check. When every candidate is unhealthy the manager ends in NO_BROKER.
 */
@Slf4j
@Service
public class BrokerManager {

    private final BrokerRegistry registry;
    private final BrokerProperties properties;
    private final MetricsService metricsService;
    private final ExecutorService healthExecutor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "broker-health");
        thread.setDaemon(true);
        return thread;
    });

    private volatile String currentName;
    private volatile BrokerSelectionState state = BrokerSelectionState.NO_BROKER;

    public BrokerManager(BrokerRegistry registry, BrokerProperties properties, MetricsService metricsService) {
        this.registry = registry;
        this.properties = properties;
        this.metricsService = metricsService;
    }

    public Broker getBroker() {
        return getBroker(false);
    }

    public synchronized Broker getBroker(boolean forceRefresh) {
        String previous = currentName;
        if (!forceRefresh && previous != null) {
            Optional<Broker> cached = registry.get(previous);
            if (cached.isPresent() && isHealthy(cached.get())) {
                state = BrokerSelectionState.ACTIVE;
                return cached.get();
            }
            log.warn("Current broker {} failed its health check, selecting again", previous);
        }

        state = BrokerSelectionState.SELECTING;
        currentName = null;
        for (String candidate : candidates()) {
            Optional<Broker> broker = registry.get(candidate);
            if (broker.isEmpty()) {
                log.warn("Broker {} is not registered or could not be created", candidate);
                continue;
            }
            if (isHealthy(broker.get())) {
                currentName = candidate;
                state = BrokerSelectionState.ACTIVE;
                if (!candidate.equals(properties.getPrimary())) {
                    metricsService.recordBrokerFailover(previous != null ? previous : properties.getPrimary(), candidate);
                } else {
                    log.info("Using primary broker {}", candidate);
                }
                return broker.get();
            }
            log.warn("Broker {} is unhealthy", candidate);
        }

        state = BrokerSelectionState.NO_BROKER;
        throw new NoBrokerAvailableException("No available broker: primary '" + properties.getPrimary()
                + "' and failovers " + (properties.isFailoverEnabled() ? properties.getFailover() : List.of())
                + " are all unhealthy");
    }

    public Optional<Broker> getBrokerByName(String name) {
        return registry.get(name);
    }

    public Optional<String> getCurrentBrokerName() {
        return Optional.ofNullable(currentName);
    }

    public BrokerSelectionState getState() {
        return state;
    }

    public Map<String, BrokerHealthView> getAllBrokerHealth() {
        Map<String, BrokerHealthView> health = new LinkedHashMap<>();
        Set<String> names = new LinkedHashSet<>(candidates());
        names.addAll(registry.names());
        for (String name : names) {
            Optional<Broker> broker = registry.get(name);
            BrokerHealth details = broker.map(this::healthDetails)
                    .orElseGet(() -> BrokerHealth.unhealthy(name, "Broker is not registered or could not be created"));
            health.put(name, new BrokerHealthView(name, details.healthy(), name.equals(properties.getPrimary()),
                    name.equals(currentName), details));
        }
        return health;
    }

    /**
     * Health probe bounded by {@code broker.health-check-timeout}. Exceptions and timeouts count as unhealthy.
     */
    boolean isHealthy(Broker broker) {
        CompletableFuture<Boolean> probe = CompletableFuture.supplyAsync(broker::healthCheck, healthExecutor);
        try {
            return Boolean.TRUE.equals(probe.get(properties.getHealthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            probe.cancel(true);
            log.warn("Health check for {} timed out after {}", broker.name(), properties.getHealthCheckTimeout());
            return false;
        } catch (ExecutionException e) {
            log.warn("Health check for {} threw {}", broker.name(), e.getCause() != null ? e.getCause().toString() : e.toString());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private BrokerHealth healthDetails(Broker broker) {
        CompletableFuture<BrokerHealth> probe = CompletableFuture.supplyAsync(broker::getHealthStatus, healthExecutor);
        try {
            return probe.get(properties.getHealthCheckTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            probe.cancel(true);
            return BrokerHealth.unhealthy(broker.name(), "Health status timed out");
        } catch (ExecutionException e) {
            return BrokerHealth.unhealthy(broker.name(), String.valueOf(e.getCause()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return BrokerHealth.unhealthy(broker.name(), "Interrupted");
        }
    }

    private List<String> candidates() {
        List<String> candidates = new ArrayList<>();
        candidates.add(properties.getPrimary());
        if (properties.isFailoverEnabled()) {
            for (String name : properties.getFailover()) {
                if (!candidates.contains(name)) {
                    candidates.add(name);
                }
            }
        }
        return candidates;
    }

    @PreDestroy
    void shutdown() {
        healthExecutor.shutdownNow();
    }
}
