package com.apex.gate.service.broker;

import com.apex.gate.model.Fill;
import com.apex.gate.model.Order;
import com.apex.gate.model.PortfolioPosition;
import com.apex.gate.model.PortfolioState;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Uniform contract over an execution venue. Implementations are long-lived and shared across runs.
 */
public interface Broker {

    String name();

    BrokerAccount getAccount();

    PortfolioState getPositions();

    Optional<PortfolioPosition> getPosition(String symbol);

    /**
     * Submits the orders in sequence. With {@code verifyFills} each submitted order is polled until it
     * fills, reaches a terminal state or {@code fillTimeout} elapses. Without verification a venue that does not
     * fill synchronously reports each accepted order as a fill at its limit price, or at 0.0 for a market order;
     * such fills acknowledge submission only.
     *
     * @throws OrderExecutionException when submission stops part way; it carries the fills obtained so far
     */
    List<Fill> executeOrders(List<Order> orders, boolean verifyFills, Duration fillTimeout);

    BrokerOrderStatus getOrderStatus(String orderId);

    /**
     * @return false when the broker does not know the order
     */
    boolean cancelOrder(String orderId);

    CancelAllResult cancelAllOrders();

    Optional<Fill> verifyFill(String orderId, Duration timeout, Duration pollInterval);

    boolean healthCheck();

    BrokerHealth getHealthStatus();

    /**
     * Latest quotes seen by the pipeline. Venues that price fills themselves ignore this.
     */
    default void onMarketPrices(Map<String, Double> latestPrices) {
    }
}
