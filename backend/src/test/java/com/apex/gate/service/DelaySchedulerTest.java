package com.apex.gate.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class DelaySchedulerTest {

    private final DelayScheduler scheduler = new DelayScheduler();

    @Test
    void pausesForRequestedDuration() {
        long started = System.nanoTime();

        assertThat(scheduler.pause(Duration.ofMillis(30))).isTrue();

        assertThat(Duration.ofNanos(System.nanoTime() - started)).isGreaterThanOrEqualTo(Duration.ofMillis(25));
    }

    @Test
    void zeroPauseReturnsImmediately() {
        assertThat(scheduler.pause(Duration.ZERO)).isTrue();
        assertThat(scheduler.pause(null)).isTrue();
    }

    @Test
    void pauseAfterShutdownIsRefused() {
        scheduler.shutdown();

        assertThat(scheduler.pause(Duration.ofMillis(10))).isFalse();
    }
}
