package com.apex.gate.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Blocking pauses backed by a shared daemon scheduler, used between fill-status polls.
 */
@Service
@Slf4j
public class DelayScheduler {

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread thread = new Thread(r, "fill-poll-delay");
        thread.setDaemon(true);
        return thread;
    });

    /**
     * Pauses the caller for the given duration.
     *
     * @return false if the calling thread was interrupted while waiting or the scheduler has been shut down
     */
    public boolean pause(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        CompletableFuture<Void> future = new CompletableFuture<>();
        try {
            scheduler.schedule(() -> future.complete(null), duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Pause of {} rejected, scheduler is shut down", duration);
            return false;
        }
        try {
            future.get();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Pause interrupted after requesting {}", duration);
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Delay scheduler failed", e);
        }
    }

    // Pauses already scheduled still complete; later ones are refused
    @PreDestroy
    void shutdown() {
        scheduler.shutdown();
    }
}
