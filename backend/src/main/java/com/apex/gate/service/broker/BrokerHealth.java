package com.apex.gate.service.broker;

public record BrokerHealth(
        String broker,
        boolean healthy,
        String accountStatus,
        boolean tradingBlocked,
        boolean patternDayTrader,
        String error
) {

    public static BrokerHealth unhealthy(String broker, String error) {
        return new BrokerHealth(broker, false, null, false, false, error);
    }
}
