package com.apex.gate.service.broker;

import com.apex.gate.config.AlpacaProperties;
import com.apex.gate.config.ExecutionProperties;
import com.apex.gate.exception.BrokerApiException;
import com.apex.gate.exception.ProviderAuthException;
import com.apex.gate.exception.ProviderTransientException;
import com.apex.gate.model.Fill;
import com.apex.gate.model.Order;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.OrderType;
import com.apex.gate.model.PortfolioPosition;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.service.DelayScheduler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Alpaca trading API over REST. Transient failures are retried inside {@link AlpacaHttpClient}.
 */
@Slf4j
@RequiredArgsConstructor
public class AlpacaBroker implements Broker {

    public static final String NAME = "alpaca";

    private final AlpacaHttpClient httpClient;
    private final AlpacaProperties alpacaProperties;
    private final ExecutionProperties executionProperties;
    private final DelayScheduler delayScheduler;
    private final ObjectMapper objectMapper;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BrokerAccount getAccount() {
        return parseAccount(read(httpClient.get("/v2/account")));
    }

    @Override
    public PortfolioState getPositions() {
        BrokerAccount account = getAccount();
        JsonNode root = read(httpClient.get("/v2/positions"));
        List<PortfolioPosition> positions = new ArrayList<>();
        if (root.isArray()) {
            for (JsonNode node : root) {
                positions.add(parsePosition(node));
            }
        }
        return new PortfolioState(account.cash(), positions);
    }

    @Override
    public Optional<PortfolioPosition> getPosition(String symbol) {
        try {
            return Optional.of(parsePosition(read(httpClient.get("/v2/positions/" + symbol))));
        } catch (BrokerApiException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    @Override
    public List<Fill> executeOrders(List<Order> orders, boolean verifyFills, Duration fillTimeout) {
        List<Fill> fills = new ArrayList<>();
        for (Order order : orders) {
            if (order.type() == OrderType.LIMIT && order.limitPrice() == null) {
                log.warn("Limit order for {} has no limit price, skipping", order.symbol());
                continue;
            }
            BrokerOrderStatus submitted;
            try {
                submitted = parseOrder(read(httpClient.post("/v2/orders", payload(order))));
            } catch (ProviderAuthException | ProviderTransientException e) {
                throw new OrderExecutionException("Order submission to Alpaca failed for " + order.symbol()
                        + ": " + e.getMessage(), fills, e);
            } catch (BrokerApiException e) {
                log.warn("Alpaca rejected order for {} {} {}: {}", order.side(), order.quantity(), order.symbol(), e.getMessage());
                continue;
            }
            log.info("Submitted Alpaca order {} {} {} {}", submitted.orderId(), order.side(), order.quantity(), order.symbol());
            if (submitted.isFilled()) {
                fills.add(toFill(submitted));
            } else if (verifyFills) {
                verifyFill(submitted.orderId(), fillTimeout, executionProperties.getPollInterval())
                        .ifPresentOrElse(fills::add,
                                () -> log.warn("Order {} for {} was not filled within {}", submitted.orderId(), order.symbol(), fillTimeout));
            } else {
                // Submission acknowledgement, not an execution price
                fills.add(new Fill(submitted.orderId(), order.symbol(), order.side(), order.quantity(),
                        order.limitPrice() != null ? order.limitPrice() : 0.0,
                        submitted.submittedAt() != null ? submitted.submittedAt() : Instant.now()));
            }
        }
        return fills;
    }

    @Override
    public BrokerOrderStatus getOrderStatus(String orderId) {
        return parseOrder(read(httpClient.get("/v2/orders/" + orderId)));
    }

    @Override
    public boolean cancelOrder(String orderId) {
        try {
            httpClient.delete("/v2/orders/" + orderId);
            log.info("Cancelled Alpaca order {}", orderId);
            return true;
        } catch (BrokerApiException e) {
            if (e.getStatusCode() == 404 || e.getStatusCode() == 422) {
                log.warn("Alpaca order {} could not be cancelled (status {})", orderId, e.getStatusCode());
                return false;
            }
            throw e;
        }
    }

    @Override
    public CancelAllResult cancelAllOrders() {
        JsonNode open = read(httpClient.get("/v2/orders?status=open"));
        List<String> errors = new ArrayList<>();
        int total = 0;
        int cancelled = 0;
        if (open.isArray()) {
            for (JsonNode node : open) {
                total++;
                String orderId = node.path("id").asText();
                try {
                    if (cancelOrder(orderId)) {
                        cancelled++;
                    } else {
                        errors.add("Order " + orderId + " could not be cancelled");
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to cancel Alpaca order {}", orderId, e);
                    errors.add("Order " + orderId + ": " + e.getMessage());
                }
            }
        }
        String message = String.format("Cancelled %d of %d open orders", cancelled, total);
        log.info(message);
        return new CancelAllResult(cancelled, total, errors, message);
    }

    @Override
    public Optional<Fill> verifyFill(String orderId, Duration timeout, Duration pollInterval) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                BrokerOrderStatus status = getOrderStatus(orderId);
                if (status.isFilled()) {
                    return Optional.of(toFill(status));
                }
                if (status.isTerminalWithoutFill()) {
                    log.warn("Order {} ended as {} without a fill", orderId, status.status());
                    return Optional.empty();
                }
            } catch (ProviderTransientException e) {
                log.warn("Fill status for {} unavailable: {}", orderId, e.getMessage());
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                log.warn("Fill verification for {} timed out after {}", orderId, timeout);
                return Optional.empty();
            }
            Duration pause = pollInterval.toNanos() < remaining ? pollInterval : Duration.ofNanos(remaining);
            if (!delayScheduler.pause(pause)) {
                return Optional.empty();
            }
        }
    }

    @Override
    public boolean healthCheck() {
        if (httpClient.circuitState() == CircuitBreaker.State.OPEN) {
            return false;
        }
        try {
            httpClient.probe("/v2/account");
            return true;
        } catch (RuntimeException e) {
            log.warn("Alpaca health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public BrokerHealth getHealthStatus() {
        try {
            BrokerAccount account = parseAccount(read(httpClient.probe("/v2/account")));
            return new BrokerHealth(NAME, true, account.status(), account.tradingBlocked(), account.patternDayTrader(), null);
        } catch (RuntimeException e) {
            return BrokerHealth.unhealthy(NAME, e.getMessage());
        }
    }

    private String payload(Order order) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("symbol", order.symbol());
        payload.put("qty", order.quantity());
        payload.put("side", order.side().wireValue());
        payload.put("type", order.type().wireValue());
        payload.put("time_in_force", alpacaProperties.getTimeInForce());
        if (order.type() == OrderType.LIMIT) {
            payload.put("limit_price", order.limitPrice());
        }
        return payload.toString();
    }

    private JsonNode read(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new BrokerApiException("Malformed Alpaca response", e);
        }
    }

    private BrokerAccount parseAccount(JsonNode node) {
        return new BrokerAccount(
                node.path("id").asText(null),
                node.path("status").asText("UNKNOWN"),
                node.path("cash").asDouble(0.0),
                node.path("equity").asDouble(0.0),
                node.path("buying_power").asDouble(0.0),
                node.path("trading_blocked").asBoolean(false),
                node.path("pattern_day_trader").asBoolean(false));
    }

    private PortfolioPosition parsePosition(JsonNode node) {
        return new PortfolioPosition(
                node.path("symbol").asText(),
                node.path("qty").asDouble(0.0),
                node.path("avg_entry_price").asDouble(0.0));
    }

    private BrokerOrderStatus parseOrder(JsonNode node) {
        String side = node.path("side").asText(null);
        JsonNode avgPrice = node.path("filled_avg_price");
        return new BrokerOrderStatus(
                node.path("id").asText(null),
                node.path("symbol").asText(null),
                side == null ? null : OrderSide.fromValue(side),
                node.path("status").asText("unknown"),
                node.path("qty").asDouble(0.0),
                node.path("filled_qty").asDouble(0.0),
                avgPrice.isMissingNode() || avgPrice.isNull() ? null : avgPrice.asDouble(),
                parseInstant(node.path("submitted_at").asText(null)),
                parseInstant(node.path("filled_at").asText(null)));
    }

    private Fill toFill(BrokerOrderStatus status) {
        double quantity = status.filledQuantity() > 0 ? status.filledQuantity() : status.quantity();
        return new Fill(status.orderId(), status.symbol(), status.side(), quantity,
                status.filledAveragePrice() != null ? status.filledAveragePrice() : 0.0,
                status.filledAt() != null ? status.filledAt() : Instant.now());
    }

    private static Instant parseInstant(String value) {
        if (value == null || value.isBlank() || "null".equals(value)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            log.debug("Unparseable Alpaca timestamp {}", value);
            return null;
        }
    }
}
