package com.apex.gate.service;

import com.apex.gate.config.BacktestProperties;
import com.apex.gate.model.BacktestCosts;
import com.apex.gate.model.BacktestMetrics;
import com.apex.gate.model.BacktestResult;
import com.apex.gate.model.Bar;
import com.apex.gate.model.EquityPoint;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.PositionSizing;
import com.apex.gate.model.RuleType;
import com.apex.gate.model.StrategyRule;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.Trade;
import com.apex.gate.service.indicator.IndicatorService;
import com.apex.gate.service.indicator.IndicatorService.RuleSignal;
import com.apex.gate.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
@Slf4j
@RequiredArgsConstructor
public class BacktestEngine {

    private static final Pattern TIMEFRAME = Pattern.compile("^(\\d*)\\s*(mo|M|m|h|d|w)$");
    private static final double TRADING_DAYS = 252.0;

    private final BacktestProperties properties;
    private final IndicatorService indicatorService;

    public BacktestResult run(StrategySpec strategy, Map<String, List<Bar>> barsBySymbol, BacktestCosts costs) {
        BacktestCosts effectiveCosts = costs != null ? costs : BacktestCosts.defaults();
        Map<String, SymbolBook> books = prepareBooks(strategy, barsBySymbol);
        if (books.isEmpty()) {
            log.warn("No bars available for backtest of strategy {}", strategy.strategyId());
            return new BacktestResult(strategy, BacktestMetrics.zero(), List.of(), List.of());
        }

        TreeSet<LocalDateTime> timeline = new TreeSet<>();
        books.values().forEach(book -> timeline.addAll(book.indexByTime.keySet()));

        double initialCapital = properties.getInitialCapital();
        double cash = initialCapital;
        List<Trade> trades = new ArrayList<>();
        List<EquityPoint> equityCurve = new ArrayList<>();

        for (LocalDateTime timestamp : timeline) {
            for (SymbolBook book : books.values()) {
                Integer index = book.indexByTime.get(timestamp);
                if (index != null) {
                    book.lastPrice = book.closes[index];
                }
            }
            double equity = equity(cash, books);
            for (SymbolBook book : books.values()) {
                Integer index = book.indexByTime.get(timestamp);
                if (index == null || index < 1) {
                    continue;
                }
                double price = book.closes[index];
                boolean entrySignal = book.entryFires(index);
                if (book.quantity == 0.0 && entrySignal) {
                    double target = strategy.params().positionSizing() == PositionSizing.FIXED_SIZE
                            ? properties.getFixedSizeNotional()
                            : equity * strategy.params().fraction();
                    double quantity = price > 0 ? MoneyUtils.roundQuantity(target / price) : 0.0;
                    double fillPrice = price * (1 + effectiveCosts.slippagePct());
                    double totalCost = quantity * fillPrice * (1 + effectiveCosts.commission());
                    if (quantity > 0 && cash >= totalCost) {
                        cash -= totalCost;
                        book.quantity = quantity;
                        trades.add(new Trade(timestamp, book.symbol, OrderSide.BUY, quantity, fillPrice));
                        log.debug("Entered {} {} at {}", quantity, book.symbol, fillPrice);
                    }
                } else if (book.quantity > 0 && book.exitFires(index, entrySignal)) {
                    cash += close(book, price, timestamp, effectiveCosts, trades);
                }
            }
            equityCurve.add(new EquityPoint(timestamp, equity(cash, books)));
        }

        if (properties.isCloseOpenPositionsAtEnd()) {
            LocalDateTime last = timeline.last();
            boolean closedAny = false;
            for (SymbolBook book : books.values()) {
                if (book.quantity > 0) {
                    cash += close(book, book.lastPrice, last, effectiveCosts, trades);
                    closedAny = true;
                }
            }
            if (closedAny) {
                equityCurve.set(equityCurve.size() - 1, new EquityPoint(last, equity(cash, books)));
            }
        }

        BacktestMetrics metrics = calculateMetrics(initialCapital, equityCurve, strategy.params().timeframe());
        log.info("Backtest complete for {}: {} trades, sharpe={}, return={}, maxDrawdown={}",
                strategy.strategyId(), trades.size(), format(metrics.sharpe()),
                format(metrics.totalReturn()), format(metrics.maxDrawdown()));
        return new BacktestResult(strategy, metrics, trades, equityCurve);
    }

    BacktestMetrics calculateMetrics(double initialCapital, List<EquityPoint> equityCurve, String timeframe) {
        if (equityCurve.isEmpty()) {
            return BacktestMetrics.zero();
        }
        List<Double> values = new ArrayList<>(equityCurve.size() + 1);
        values.add(initialCapital);
        equityCurve.forEach(point -> values.add(point.value()));

        double[] returns = new double[values.size() - 1];
        for (int i = 1; i < values.size(); i++) {
            double previous = values.get(i - 1);
            returns[i - 1] = previous > 0 ? (values.get(i) - previous) / previous : 0.0;
        }
        double mean = 0.0;
        for (double r : returns) {
            mean += r;
        }
        mean /= returns.length;
        double variance = 0.0;
        for (double r : returns) {
            variance += (r - mean) * (r - mean);
        }
        double stdDev = returns.length > 1 ? Math.sqrt(variance / returns.length) : 0.0;
        double sharpe = stdDev > 1e-12 ? mean / stdDev * Math.sqrt(periodsPerYear(timeframe)) : 0.0;

        double peak = initialCapital;
        double maxDrawdown = 0.0;
        for (double value : values) {
            peak = Math.max(peak, value);
            double drawdown = peak > 0 ? (peak - value) / peak : 0.0;
            maxDrawdown = Math.max(maxDrawdown, drawdown);
        }
        double finalValue = values.get(values.size() - 1);
        double totalReturn = initialCapital > 0 ? finalValue / initialCapital - 1 : 0.0;
        return new BacktestMetrics(sharpe, Math.min(1.0, maxDrawdown), totalReturn);
    }

    /**
     * Number of bars per year for a timeframe such as {@code 1d}, {@code 4h}, {@code 15m}, {@code 1w} or {@code 1mo}.
     * Unrecognized values are treated as daily.
     */
    static double periodsPerYear(String timeframe) {
        if (timeframe == null) {
            return TRADING_DAYS;
        }
        Matcher matcher = TIMEFRAME.matcher(timeframe.trim());
        if (!matcher.matches()) {
            return TRADING_DAYS;
        }
        int multiple = matcher.group(1).isEmpty() ? 1 : Math.max(1, Integer.parseInt(matcher.group(1)));
        return switch (matcher.group(2)) {
            case "m" -> TRADING_DAYS * 390.0 / multiple;
            case "h" -> TRADING_DAYS * 6.5 / multiple;
            case "w" -> 52.0 / multiple;
            case "mo", "M" -> 12.0 / multiple;
            default -> TRADING_DAYS / multiple;
        };
    }

    private double close(SymbolBook book, double price, LocalDateTime timestamp, BacktestCosts costs, List<Trade> trades) {
        double quantity = book.quantity;
        double fillPrice = price * (1 - costs.slippagePct());
        double proceeds = quantity * fillPrice * (1 - costs.commission());
        book.quantity = 0.0;
        trades.add(new Trade(timestamp, book.symbol, OrderSide.SELL, quantity, fillPrice));
        log.debug("Exited {} {} at {}", quantity, book.symbol, fillPrice);
        return proceeds;
    }

    private double equity(double cash, Map<String, SymbolBook> books) {
        double equity = cash;
        for (SymbolBook book : books.values()) {
            equity += book.quantity * book.lastPrice;
        }
        return equity;
    }

    private Map<String, SymbolBook> prepareBooks(StrategySpec strategy, Map<String, List<Bar>> barsBySymbol) {
        Map<String, SymbolBook> books = new LinkedHashMap<>();
        if (barsBySymbol == null || barsBySymbol.isEmpty()) {
            return books;
        }
        List<String> symbols = strategy.universe().isEmpty()
                ? barsBySymbol.keySet().stream().sorted().toList()
                : strategy.universe();
        for (String symbol : symbols) {
            List<Bar> bars = usableBars(barsBySymbol.get(symbol));
            if (bars.isEmpty()) {
                log.debug("No usable bars for {}", symbol);
                continue;
            }
            books.put(symbol, new SymbolBook(symbol, bars,
                    compile(strategy, RuleType.ENTRY, bars),
                    compile(strategy, RuleType.EXIT, bars)));
        }
        return books;
    }

    private List<RuleSignal> compile(StrategySpec strategy, RuleType type, List<Bar> bars) {
        double[] closes = bars.stream().mapToDouble(Bar::getClose).toArray();
        List<RuleSignal> signals = new ArrayList<>();
        for (StrategyRule rule : strategy.rulesOfType(type)) {
            if (!indicatorService.supports(rule.indicator())) {
                log.warn("Unknown indicator '{}' in {} rule of strategy {}; rule never fires",
                        rule.indicator(), type.wireValue(), strategy.strategyId());
                signals.add(null);
                continue;
            }
            signals.add(indicatorService.compile(rule, closes));
        }
        return signals;
    }

    private List<Bar> usableBars(List<Bar> bars) {
        if (bars == null) {
            return List.of();
        }
        Map<LocalDateTime, Bar> byTime = new HashMap<>();
        for (Bar bar : bars) {
            if (bar != null && bar.getTimestamp() != null && bar.getClose() != null) {
                byTime.put(bar.getTimestamp(), bar);
            }
        }
        return byTime.values().stream().sorted(Comparator.comparing(Bar::getTimestamp)).toList();
    }

    private static String format(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.4f", value);
    }

    private static final class SymbolBook {
        private final String symbol;
        private final double[] closes;
        private final Map<LocalDateTime, Integer> indexByTime = new HashMap<>();
        private final List<RuleSignal> entries;
        private final List<RuleSignal> exits;
        private double quantity;
        private double lastPrice;

        private SymbolBook(String symbol, List<Bar> bars, List<RuleSignal> entries, List<RuleSignal> exits) {
            this.symbol = symbol;
            this.closes = bars.stream().mapToDouble(Bar::getClose).toArray();
            for (int i = 0; i < bars.size(); i++) {
                indexByTime.put(bars.get(i).getTimestamp(), i);
            }
            this.entries = entries;
            this.exits = exits;
        }

        private boolean entryFires(int index) {
            if (entries.isEmpty()) {
                return false;
            }
            for (RuleSignal signal : entries) {
                if (signal == null || !signal.firesAt(index)) {
                    return false;
                }
            }
            return true;
        }

        private boolean exitFires(int index, boolean entrySignal) {
            if (exits.isEmpty()) {
                return !entrySignal;
            }
            for (RuleSignal signal : exits) {
                if (signal != null && signal.firesAt(index)) {
                    return true;
                }
            }
            return false;
        }
    }
}
