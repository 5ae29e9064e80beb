package com.apex.gate.service.control;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class ActiveRunRegistry {

    private final Map<String, Instant> activeRuns = new ConcurrentHashMap<>();

    public String start() {
        String runId = UUID.randomUUID().toString();
        activeRuns.put(runId, Instant.now());
        return runId;
    }

    public void finish(String runId) {
        if (runId != null) {
            activeRuns.remove(runId);
        }
    }

    public boolean isActive(String runId) {
        return runId != null && activeRuns.containsKey(runId);
    }

    public Map<String, Instant> snapshot() {
        return Map.copyOf(activeRuns);
    }

    public int count() {
        return activeRuns.size();
    }
}
