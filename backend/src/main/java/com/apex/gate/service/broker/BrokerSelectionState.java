package com.apex.gate.service.broker;

public enum BrokerSelectionState {
    NO_BROKER,
    SELECTING,
    ACTIVE
}
