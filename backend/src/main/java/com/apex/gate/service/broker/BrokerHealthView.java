package com.apex.gate.service.broker;

public record BrokerHealthView(String broker, boolean healthy, boolean primary, boolean current, BrokerHealth details) {
}
