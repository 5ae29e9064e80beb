package com.apex.gate.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;

@Service
@Slf4j
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter pipelineRunsCounter;
    private Counter pipelineBlockedCounter;
    private Counter ordersApprovedCounter;
    private Counter ordersRejectedCounter;
    private Counter ordersFilledCounter;
    private Counter gatingFailuresCounter;
    private Counter brokerFailoversCounter;
    private Counter brokerErrorsCounter;

    @PostConstruct
    void init() {
        pipelineRunsCounter = Counter.builder("pipeline_runs_total").register(meterRegistry);
        pipelineBlockedCounter = Counter.builder("pipeline_runs_blocked_total").register(meterRegistry);
        ordersApprovedCounter = Counter.builder("orders_approved_total").register(meterRegistry);
        ordersRejectedCounter = Counter.builder("orders_rejected_total").register(meterRegistry);
        ordersFilledCounter = Counter.builder("orders_filled_total").register(meterRegistry);
        gatingFailuresCounter = Counter.builder("scenario_gating_failures_total").register(meterRegistry);
        brokerFailoversCounter = Counter.builder("broker_failovers_total").register(meterRegistry);
        brokerErrorsCounter = Counter.builder("broker_errors_total").register(meterRegistry);
    }

    public void recordPipelineRun() {
        increment(pipelineRunsCounter, 1);
    }

    public void recordPipelineBlocked() {
        increment(pipelineBlockedCounter, 1);
    }

    public void recordRiskOutcome(int approved, int rejected) {
        increment(ordersApprovedCounter, approved);
        increment(ordersRejectedCounter, rejected);
    }

    public void recordOrdersFilled(int count) {
        increment(ordersFilledCounter, count);
    }

    public void recordGatingFailure() {
        increment(gatingFailuresCounter, 1);
    }

    public void recordBrokerFailover(String from, String to) {
        log.warn("Broker failover from {} to {}", from, to);
        increment(brokerFailoversCounter, 1);
    }

    public void recordBrokerError() {
        increment(brokerErrorsCounter, 1);
    }

    public void recordBrokerCall(String broker, String method, boolean success, Duration elapsed) {
        Timer.builder("broker_call_latency")
                .tag("broker", broker)
                .tag("method", method)
                .tag("status", success ? "success" : "error")
                .register(meterRegistry)
                .record(elapsed);
    }

    private void increment(Counter counter, int amount) {
        if (counter != null && amount > 0) {
            counter.increment(amount);
        }
    }
}
