package com.apex.gate.service.risk;

import com.apex.gate.config.RiskProperties;
import com.apex.gate.model.Order;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.model.PositionSizing;
import com.apex.gate.model.RiskAssessment;
import com.apex.gate.model.RiskLevel;
import com.apex.gate.model.StrategySpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultRiskEngine implements RiskEngine {

    private final RiskProperties properties;

    @Override
    public RiskAssessment assess(RiskRequest request) {
        PortfolioState portfolio = request.portfolio() != null ? request.portfolio() : PortfolioState.cashOnly(0.0);
        Map<String, Double> prices = request.latestPrices();
        List<String> violations = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<Order> approved = new ArrayList<>();

        double portfolioValue = portfolio.totalValue(prices);
        double grossExposure = portfolio.grossPositionValue(prices);

        Double currentDrawdown = null;
        boolean drawdownBlocked = false;
        List<Double> curve = request.equityCurve();
        if (curve != null && !curve.isEmpty()) {
            currentDrawdown = DrawdownCalculator.current(curve);
            if (currentDrawdown > properties.getMaxDrawdownThreshold()) {
                drawdownBlocked = true;
                violations.add(String.format(Locale.ROOT,
                        "Drawdown circuit breaker: current drawdown %.2f%% exceeds max drawdown threshold %.2f%%",
                        currentDrawdown * 100, properties.getMaxDrawdownThreshold() * 100));
            } else if (currentDrawdown > properties.getMaxDrawdownThreshold() * 0.8) {
                warnings.add(String.format(Locale.ROOT, "Current drawdown %.2f%% is approaching the %.2f%% threshold",
                        currentDrawdown * 100, properties.getMaxDrawdownThreshold() * 100));
            }
        }

        if (!drawdownBlocked) {
            for (Order order : request.proposedOrders()) {
                Optional<String> rejection = check(order, portfolio, portfolioValue, grossExposure, request, warnings);
                if (rejection.isPresent()) {
                    violations.add(rejection.get());
                } else {
                    approved.add(order);
                }
            }
        }

        double exposureAfter = grossExposure;
        for (Order order : approved) {
            double notional = order.quantity() * referencePrice(order, prices);
            exposureAfter += order.side() == OrderSide.BUY ? notional : -notional;
        }
        double exposureUsage = portfolioValue > 0
                ? clamp(Math.max(0.0, exposureAfter) / portfolioValue / properties.getMaxPortfolioExposure())
                : 1.0;
        double drawdownProximity = currentDrawdown != null
                ? clamp(currentDrawdown / properties.getMaxDrawdownThreshold())
                : 0.0;
        double riskScore = score(exposureUsage, drawdownProximity);

        Double valueAtRisk = null;
        if (curve != null && curve.size() - 1 >= properties.getValueAtRisk().getMinReturns()) {
            valueAtRisk = DrawdownCalculator.valueAtRisk(curve, properties.getValueAtRisk().getConfidenceLevel(),
                    Math.max(0.0, portfolioValue), properties.getValueAtRisk().getMinReturns());
        }

        RiskLevel level;
        if (!violations.isEmpty()) {
            level = RiskLevel.BLOCK;
        } else if (riskScore >= properties.getScoring().getWarningScore()) {
            level = RiskLevel.WARNING;
        } else {
            level = RiskLevel.SAFE;
        }
        if (!violations.isEmpty()) {
            log.info("Risk assessment rejected {} of {} orders: {}", request.proposedOrders().size() - approved.size(),
                    request.proposedOrders().size(), violations);
        }
        return new RiskAssessment(approved, violations, level, riskScore, warnings, currentDrawdown, drawdownBlocked, valueAtRisk);
    }

    @Override
    public List<String> checkStrategy(StrategySpec strategy) {
        List<String> violations = new ArrayList<>();
        if (strategy == null) {
            violations.add("Strategy is missing");
            return violations;
        }
        if (strategy.params().positionSizing() == PositionSizing.FIXED_FRACTION) {
            double fraction = strategy.params().fraction();
            if (fraction < properties.getMinFraction() || fraction > properties.getMaxFraction()) {
                violations.add(String.format(Locale.ROOT, "Strategy %s fraction %.4f outside allowed range [%.2f, %.2f]",
                        strategy.strategyId(), fraction, properties.getMinFraction(), properties.getMaxFraction()));
            }
        }
        if (strategy.universe().isEmpty()) {
            violations.add("Strategy " + strategy.strategyId() + " has an empty universe");
        }
        Set<String> blacklist = blacklist();
        for (String symbol : strategy.universe()) {
            if (blacklist.contains(symbol.toUpperCase(Locale.ROOT))) {
                violations.add("Strategy " + strategy.strategyId() + " universe contains blacklisted symbol " + symbol);
            }
        }
        return violations;
    }

    private Optional<String> check(Order order, PortfolioState portfolio, double portfolioValue, double grossExposure,
                                   RiskRequest request, List<String> warnings) {
        if (order.quantity() <= 0) {
            return Optional.of("Order for " + order.symbol() + " has non-positive quantity " + order.quantity());
        }
        if (blacklist().contains(order.symbol().toUpperCase(Locale.ROOT))) {
            return Optional.of("Symbol " + order.symbol() + " is blacklisted");
        }

        double price = referencePrice(order, request.latestPrices());
        if (order.limitPrice() == null && !request.latestPrices().containsKey(order.symbol())) {
            warnings.add(String.format(Locale.ROOT, "No price for %s, using fallback reference price %.2f",
                    order.symbol(), properties.getFallbackReferencePrice()));
        }
        double notional = Math.abs(order.quantity()) * price;
        if (notional > properties.getMaxTradeNotional()) {
            return Optional.of(String.format(Locale.ROOT, "Order for %s exceeds max trade notional (%.2f > %.2f)",
                    order.symbol(), notional, properties.getMaxTradeNotional()));
        }
        if (order.side() == OrderSide.SELL) {
            return Optional.empty();
        }

        if (portfolioValue <= 0) {
            return Optional.of("Order for " + order.symbol() + " rejected: portfolio value is not positive");
        }
        double exposure = (grossExposure + notional) / portfolioValue;
        if (exposure > properties.getMaxPortfolioExposure()) {
            return Optional.of(String.format(Locale.ROOT, "Order for %s exceeds max portfolio exposure (%.2f%% > %.2f%%)",
                    order.symbol(), exposure * 100, properties.getMaxPortfolioExposure() * 100));
        }
        double symbolShare = (Math.abs(portfolio.markToMarket(order.symbol(), request.latestPrices())) + notional) / portfolioValue;
        if (symbolShare > properties.getMaxPositionPerSymbol()) {
            return Optional.of(String.format(Locale.ROOT, "Order for %s exceeds per-symbol position limit (%.2f%% > %.2f%%)",
                    order.symbol(), symbolShare * 100, properties.getMaxPositionPerSymbol() * 100));
        }

        Double averageVolume = request.averageDailyVolumes().get(order.symbol());
        if (averageVolume != null) {
            RiskProperties.Liquidity liquidity = properties.getLiquidity();
            if (averageVolume < liquidity.getMinAvgVolume()) {
                return Optional.of(String.format(Locale.ROOT, "Symbol %s has insufficient average daily volume (%.0f < %.0f)",
                        order.symbol(), averageVolume, liquidity.getMinAvgVolume()));
            }
            double volumeRatio = order.quantity() / averageVolume;
            if (volumeRatio > liquidity.getMaxVolumeRatio()) {
                return Optional.of(String.format(Locale.ROOT,
                        "Trade size for %s is too large relative to daily volume (%.2f%% > %.2f%%)",
                        order.symbol(), volumeRatio * 100, liquidity.getMaxVolumeRatio() * 100));
            }
        }
        return Optional.empty();
    }

    private double referencePrice(Order order, Map<String, Double> latestPrices) {
        if (order.limitPrice() != null) {
            return order.limitPrice();
        }
        Double latest = latestPrices.get(order.symbol());
        return latest != null ? latest : properties.getFallbackReferencePrice();
    }

    private double score(double exposureUsage, double drawdownProximity) {
        double exposureWeight = properties.getScoring().getExposureWeight();
        double drawdownWeight = properties.getScoring().getDrawdownWeight();
        double total = exposureWeight + drawdownWeight;
        if (total <= 0) {
            return 0.0;
        }
        return clamp((exposureWeight * exposureUsage + drawdownWeight * drawdownProximity) / total);
    }

    private Set<String> blacklist() {
        return properties.getBlacklist().stream()
                .map(symbol -> symbol.trim().toUpperCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
