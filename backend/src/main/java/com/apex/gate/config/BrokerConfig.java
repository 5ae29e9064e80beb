package com.apex.gate.config;

import com.apex.gate.service.DelayScheduler;
import com.apex.gate.service.broker.AlpacaBroker;
import com.apex.gate.service.broker.AlpacaHttpClient;
import com.apex.gate.service.broker.BrokerRegistry;
import com.apex.gate.service.broker.PaperBroker;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
public class BrokerConfig {

    @Bean
    public BrokerRegistry brokerRegistry(AlpacaHttpClient alpacaHttpClient,
                                         AlpacaProperties alpacaProperties,
                                         ExecutionProperties executionProperties,
                                         BrokerProperties brokerProperties,
                                         DelayScheduler delayScheduler,
                                         ObjectMapper objectMapper) {
        if (!alpacaProperties.hasCredentials()) {
            log.warn("Alpaca credentials are not configured; the alpaca broker will report unhealthy");
        }
        return new BrokerRegistry()
                .register(AlpacaBroker.NAME, () -> new AlpacaBroker(alpacaHttpClient, alpacaProperties,
                        executionProperties, delayScheduler, objectMapper))
                .register(PaperBroker.NAME, () -> new PaperBroker(brokerProperties.getPaper().getStartingCash()));
    }
}
