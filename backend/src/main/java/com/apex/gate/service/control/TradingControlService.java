package com.apex.gate.service.control;

import com.apex.gate.exception.NoBrokerAvailableException;
import com.apex.gate.service.broker.Broker;
import com.apex.gate.service.broker.BrokerManager;
import com.apex.gate.service.broker.BrokerOrderStatus;
import com.apex.gate.service.broker.CancelAllResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Operator actions that must keep working while the kill switch is on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradingControlService {

    private final BrokerManager brokerManager;
    private final KillSwitchService killSwitchService;
    private final ActiveRunRegistry activeRunRegistry;

    public CancelAllResult cancelAllOrders() {
        Broker broker = brokerManager.getBroker();
        CancelAllResult result = broker.cancelAllOrders();
        log.warn("Cancel-all on {}: {} of {} open orders cancelled", broker.name(),
                result.cancelledCount(), result.totalOrders());
        return result;
    }

    public CancelAllResult cancelAllOrders(String brokerName) {
        return resolve(brokerName).cancelAllOrders();
    }

    public BrokerOrderStatus getOrderStatus(String orderId) {
        return brokerManager.getBroker().getOrderStatus(orderId);
    }

    /**
     * Looks the order up on the broker that placed it, which after a failover may no longer be the selected one.
     */
    public BrokerOrderStatus getOrderStatus(String brokerName, String orderId) {
        return resolve(brokerName).getOrderStatus(orderId);
    }

    private Broker resolve(String brokerName) {
        return brokerManager.getBrokerByName(brokerName)
                .orElseThrow(() -> new NoBrokerAvailableException("Broker '" + brokerName + "' is not registered"));
    }

    public ControlStatus status() {
        KillSwitchService.KillSwitchState killSwitch = killSwitchService.status();
        Optional<String> current = brokerManager.getCurrentBrokerName();
        return new ControlStatus(killSwitch.enabled(), killSwitch.reason(), activeRunRegistry.count(),
                current.orElse(null), brokerManager.getState().name(),
                List.copyOf(activeRunRegistry.snapshot().keySet()));
    }

    public record ControlStatus(boolean killSwitchEnabled,
                                String killSwitchReason,
                                int activeRuns,
                                String currentBroker,
                                String brokerState,
                                List<String> activeRunIds) {
    }
}
