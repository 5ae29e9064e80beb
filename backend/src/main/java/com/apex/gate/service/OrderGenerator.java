package com.apex.gate.service;

import com.apex.gate.config.BacktestProperties;
import com.apex.gate.model.Order;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.model.PositionSizing;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.Trade;
import com.apex.gate.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
@RequiredArgsConstructor
public class OrderGenerator {

    public static final double DUST_THRESHOLD = 0.01;

    private final BacktestProperties backtestProperties;

    public List<Order> generate(StrategySpec strategy, PortfolioState portfolio, Map<String, Double> latestPrices,
                                List<Trade> backtestTrades) {
        List<Order> orders = new ArrayList<>();
        Map<String, Double> prices = latestPrices != null ? latestPrices : Map.of();
        double portfolioValue = portfolio.totalValue(prices);
        if (portfolioValue <= 0) {
            log.warn("Portfolio value {} is not positive, no orders generated for {}", portfolioValue, strategy.strategyId());
            return orders;
        }

        Map<String, Double> netSignal = new HashMap<>();
        if (backtestTrades != null) {
            backtestTrades.stream()
                    .sorted(Comparator.comparing(Trade::timestamp))
                    .forEach(trade -> netSignal.merge(trade.symbol(),
                            trade.side() == OrderSide.BUY ? trade.quantity() : -trade.quantity(), Double::sum));
        }

        List<String> universe = strategy.universe().isEmpty()
                ? prices.keySet().stream().sorted().toList()
                : strategy.universe();
        for (String symbol : universe) {
            Double price = prices.get(symbol);
            if (price == null || price <= 0) {
                log.warn("No usable price for {}, skipping order generation", symbol);
                continue;
            }
            double target = Math.max(0.0, netSignal.getOrDefault(symbol, 0.0));
            if (target == 0.0) {
                target = fallbackTarget(strategy, portfolioValue, price);
            }
            target = MoneyUtils.roundQuantity(target);
            double current = portfolio.quantityOf(symbol);
            double delta = MoneyUtils.roundQuantity(target - current);
            if (Math.abs(delta) <= DUST_THRESHOLD) {
                continue;
            }
            OrderSide side = delta > 0 ? OrderSide.BUY : OrderSide.SELL;
            orders.add(Order.market(symbol, side, Math.abs(delta)));
            log.debug("Generated {} order for {} {} (target={}, current={})", side, Math.abs(delta), symbol, target, current);
        }
        log.info("Generated {} orders for strategy {}", orders.size(), strategy.strategyId());
        return orders;
    }

    private double fallbackTarget(StrategySpec strategy, double portfolioValue, double price) {
        double notional = strategy.params().positionSizing() == PositionSizing.FIXED_SIZE
                ? backtestProperties.getFixedSizeNotional()
                : portfolioValue * strategy.params().fraction();
        return notional / price;
    }
}
