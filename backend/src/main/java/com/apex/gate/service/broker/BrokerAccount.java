package com.apex.gate.service.broker;

public record BrokerAccount(
        String accountId,
        String status,
        double cash,
        double equity,
        double buyingPower,
        boolean tradingBlocked,
        boolean patternDayTrader
) {
}
