package com.apex.gate.service.broker;

import com.apex.gate.exception.BrokerApiException;
import com.apex.gate.model.Fill;
import com.apex.gate.model.Order;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.OrderType;
import com.apex.gate.model.PortfolioPosition;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.util.MoneyUtils;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory venue that fills marketable orders at the last mark it was given. Limit orders that are not
 * marketable rest until cancelled.
 */
@Slf4j
public class PaperBroker implements Broker {

    public static final String NAME = "paper";

    private final Clock clock;
    private final Map<String, Double> marks = new ConcurrentHashMap<>();
    private final Map<String, PortfolioPosition> positions = new LinkedHashMap<>();
    private final Map<String, PaperOrder> orders = new LinkedHashMap<>();
    private volatile boolean available = true;
    private double cash;

    public PaperBroker(double startingCash) {
        this(startingCash, Clock.systemUTC());
    }

    public PaperBroker(double startingCash, Clock clock) {
        this.cash = startingCash;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    @Override
    public void onMarketPrices(Map<String, Double> latestPrices) {
        if (latestPrices != null) {
            latestPrices.forEach((symbol, price) -> {
                if (price != null && price > 0) {
                    marks.put(symbol, price);
                }
            });
        }
    }

    @Override
    public synchronized BrokerAccount getAccount() {
        double equity = cash;
        for (PortfolioPosition position : positions.values()) {
            equity += position.quantity() * marks.getOrDefault(position.symbol(), position.averagePrice());
        }
        return new BrokerAccount("paper-account", "ACTIVE", cash, equity, cash, !available, false);
    }

    @Override
    public synchronized PortfolioState getPositions() {
        return new PortfolioState(cash, new ArrayList<>(positions.values()));
    }

    @Override
    public synchronized Optional<PortfolioPosition> getPosition(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    @Override
    public synchronized List<Fill> executeOrders(List<Order> toExecute, boolean verifyFills, Duration fillTimeout) {
        List<Fill> fills = new ArrayList<>();
        for (Order order : toExecute) {
            if (order.type() == OrderType.LIMIT && order.limitPrice() == null) {
                log.warn("Limit order for {} has no limit price, skipping", order.symbol());
                continue;
            }
            String orderId = UUID.randomUUID().toString();
            Double mark = marks.get(order.symbol());
            Double price = fillPrice(order, mark);
            if (price == null) {
                String status = order.type() == OrderType.LIMIT ? "new" : "rejected";
                orders.put(orderId, new PaperOrder(orderId, order, status, null, null));
                log.info("Paper order {} for {} {} left {}", orderId, order.side(), order.symbol(), status);
                continue;
            }
            if (!apply(order, price)) {
                orders.put(orderId, new PaperOrder(orderId, order, "rejected", null, null));
                continue;
            }
            Instant now = clock.instant();
            orders.put(orderId, new PaperOrder(orderId, order, "filled", price, now));
            fills.add(new Fill(orderId, order.symbol(), order.side(), order.quantity(), price, now));
        }
        return fills;
    }

    @Override
    public synchronized BrokerOrderStatus getOrderStatus(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null) {
            throw new BrokerApiException("Unknown paper order " + orderId, 404, null);
        }
        return order.toStatus();
    }

    @Override
    public synchronized boolean cancelOrder(String orderId) {
        PaperOrder order = orders.get(orderId);
        if (order == null || !"new".equals(order.status())) {
            return false;
        }
        orders.put(orderId, new PaperOrder(orderId, order.order(), "canceled", null, null));
        return true;
    }

    @Override
    public synchronized CancelAllResult cancelAllOrders() {
        List<String> open = orders.values().stream()
                .filter(order -> "new".equals(order.status()))
                .map(PaperOrder::orderId)
                .toList();
        int cancelled = 0;
        for (String orderId : open) {
            if (cancelOrder(orderId)) {
                cancelled++;
            }
        }
        return new CancelAllResult(cancelled, open.size(), List.of(),
                String.format("Cancelled %d of %d open orders", cancelled, open.size()));
    }

    @Override
    public Optional<Fill> verifyFill(String orderId, Duration timeout, Duration pollInterval) {
        BrokerOrderStatus status = getOrderStatus(orderId);
        if (!status.isFilled()) {
            return Optional.empty();
        }
        return Optional.of(new Fill(orderId, status.symbol(), status.side(), status.filledQuantity(),
                status.filledAveragePrice(), status.filledAt()));
    }

    @Override
    public boolean healthCheck() {
        return available;
    }

    @Override
    public BrokerHealth getHealthStatus() {
        return available
                ? new BrokerHealth(NAME, true, "ACTIVE", false, false, null)
                : BrokerHealth.unhealthy(NAME, "Paper broker marked unavailable");
    }

    private Double fillPrice(Order order, Double mark) {
        if (order.type() == OrderType.MARKET) {
            return mark;
        }
        double limit = order.limitPrice();
        if (mark == null) {
            return null;
        }
        boolean marketable = order.side() == OrderSide.BUY ? limit >= mark : limit <= mark;
        return marketable ? mark : null;
    }

    private boolean apply(Order order, double price) {
        PortfolioPosition existing = positions.get(order.symbol());
        double held = existing != null ? existing.quantity() : 0.0;
        double notional = order.quantity() * price;
        if (order.side() == OrderSide.BUY) {
            if (notional > cash) {
                log.warn("Paper order for {} rejected: insufficient cash ({} > {})", order.symbol(), notional, cash);
                return false;
            }
            double quantity = held + order.quantity();
            double averagePrice = ((existing != null ? held * existing.averagePrice() : 0.0) + notional) / quantity;
            cash -= notional;
            positions.put(order.symbol(), new PortfolioPosition(order.symbol(), MoneyUtils.roundQuantity(quantity),
                    MoneyUtils.roundPrice(averagePrice)));
            return true;
        }
        if (order.quantity() > held + 1e-9) {
            log.warn("Paper order for {} rejected: selling {} but holding {}", order.symbol(), order.quantity(), held);
            return false;
        }
        cash += notional;
        double remaining = MoneyUtils.roundQuantity(held - order.quantity());
        if (remaining <= 0) {
            positions.remove(order.symbol());
        } else {
            positions.put(order.symbol(), new PortfolioPosition(order.symbol(), remaining, existing.averagePrice()));
        }
        return true;
    }

    private record PaperOrder(String orderId, Order order, String status, Double fillPrice, Instant filledAt) {

        private BrokerOrderStatus toStatus() {
            boolean filled = "filled".equals(status);
            return new BrokerOrderStatus(orderId, order.symbol(), order.side(), status, order.quantity(),
                    filled ? order.quantity() : 0.0, fillPrice, filledAt, filledAt);
        }
    }
}
