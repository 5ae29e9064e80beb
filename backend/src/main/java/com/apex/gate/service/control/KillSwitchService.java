package com.apex.gate.service.control;

import com.apex.gate.exception.KillSwitchActiveException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide kill switch. Pipeline runs read it once before doing any work.
 */
@Slf4j
@Service
public class KillSwitchService {

    private final AtomicReference<KillSwitchState> state = new AtomicReference<>(KillSwitchState.off());
    private final Clock clock;

    public KillSwitchService() {
        this(Clock.systemUTC());
    }

    KillSwitchService(Clock clock) {
        this.clock = clock;
    }

    public KillSwitchState enable(String reason) {
        KillSwitchState enabled = new KillSwitchState(true, reason, Instant.now(clock));
        state.set(enabled);
        log.warn("Kill switch enabled: {}", reason);
        return enabled;
    }

    public KillSwitchState disable() {
        KillSwitchState previous = state.getAndSet(KillSwitchState.off());
        if (previous.enabled()) {
            log.info("Kill switch disabled (was set at {} for '{}')", previous.activatedAt(), previous.reason());
        }
        return state.get();
    }

    public boolean isEnabled() {
        return state.get().enabled();
    }

    public KillSwitchState status() {
        return state.get();
    }

    public void ensureInactive() {
        KillSwitchState current = state.get();
        if (current.enabled()) {
            throw new KillSwitchActiveException("Trading blocked: kill switch is active"
                    + (current.reason() != null ? " (" + current.reason() + ")" : ""));
        }
    }

    public record KillSwitchState(boolean enabled, String reason, Instant activatedAt) {
        static KillSwitchState off() {
            return new KillSwitchState(false, null, null);
        }
    }
}
