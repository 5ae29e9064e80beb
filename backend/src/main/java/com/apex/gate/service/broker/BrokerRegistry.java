package com.apex.gate.service.broker;

import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Named broker factories. Each broker is created on first use and then shared for the life of the process.
 * A factory that fails leaves the broker unavailable; creation is attempted again on the next lookup.
 */
@Slf4j
public class BrokerRegistry {

    private final Map<String, Supplier<? extends Broker>> factories = new ConcurrentHashMap<>();
    private final Map<String, Broker> instances = new ConcurrentHashMap<>();

    public BrokerRegistry register(String name, Supplier<? extends Broker> factory) {
        factories.put(name, factory);
        return this;
    }

    public Optional<Broker> get(String name) {
        if (name == null || !factories.containsKey(name)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(instances.computeIfAbsent(name, key -> {
                log.info("Creating broker instance {}", key);
                return factories.get(key).get();
            }));
        } catch (RuntimeException e) {
            log.error("Failed to create broker {}: {}", name, e.getMessage(), e);
            return Optional.empty();
        }
    }

    public boolean isRegistered(String name) {
        return name != null && factories.containsKey(name);
    }

    public Set<String> names() {
        return new LinkedHashSet<>(factories.keySet());
    }

    public Set<String> createdNames() {
        return Set.copyOf(instances.keySet());
    }
}
