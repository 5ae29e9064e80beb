package com.apex.gate.service;

import com.apex.gate.config.BacktestProperties;
import com.apex.gate.model.BacktestCosts;
import com.apex.gate.model.BacktestResult;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.PositionSizing;
import com.apex.gate.model.RuleType;
import com.apex.gate.model.StrategyParams;
import com.apex.gate.model.StrategyRule;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.Trade;
import com.apex.gate.service.indicator.IndicatorService;
import com.apex.gate.util.TestBarFactory;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;

class BacktestEngineTest {

    private final BacktestEngine engine = new BacktestEngine(new BacktestProperties(), new IndicatorService());

    @Test
    void emptyDataProducesZeroMetrics() {
        BacktestResult result = engine.run(strategy(List.of("AAPL"), priceAbove(105)), Map.of(), BacktestCosts.defaults());

        assertThat(result.tradeLog()).isEmpty();
        assertThat(result.equityCurve()).isEmpty();
        assertThat(result.metrics().sharpe()).isZero();
        assertThat(result.metrics().maxDrawdown()).isZero();
        assertThat(result.metrics().totalReturn()).isZero();
    }

    @Test
    void entryAndExitRulesProduceRoundTrip() {
        StrategySpec strategy = strategy(List.of("AAPL"), priceAbove(105),
                new StrategyRule(RuleType.EXIT, "price", Map.of("direction", "below", "threshold", 100.0)));

        BacktestResult result = engine.run(strategy,
                Map.of("AAPL", TestBarFactory.fromCloses(100, 101, 106, 107, 104, 99, 98)), BacktestCosts.none());

        assertThat(result.tradeLog()).hasSize(2);
        Trade buy = result.tradeLog().get(0);
        Trade sell = result.tradeLog().get(1);
        assertThat(buy.side()).isEqualTo(OrderSide.BUY);
        assertThat(buy.timestamp()).isEqualTo(TestBarFactory.START.plusDays(2));
        assertThat(buy.quantity()).isEqualTo(18.87);
        assertThat(buy.price()).isEqualTo(106.0);
        assertThat(sell.side()).isEqualTo(OrderSide.SELL);
        assertThat(sell.timestamp()).isEqualTo(TestBarFactory.START.plusDays(5));
        assertThat(sell.price()).isEqualTo(99.0);

        assertThat(result.equityCurve()).hasSize(7);
        assertThat(result.metrics().totalReturn()).isCloseTo(-0.0013209, within(1e-6));
        assertThat(result.metrics().maxDrawdown()).isCloseTo(0.0015093, within(1e-6));
    }

    @Test
    void withoutExitRulesPositionClosesWhenEntryStopsHolding() {
        BacktestResult result = engine.run(strategy(List.of("AAPL"), priceAbove(105)),
                Map.of("AAPL", TestBarFactory.fromCloses(100, 106, 107, 104)), BacktestCosts.none());

        assertThat(result.tradeLog()).extracting(Trade::side).containsExactly(OrderSide.BUY, OrderSide.SELL);
        assertThat(result.tradeLog().get(1).timestamp()).isEqualTo(TestBarFactory.START.plusDays(3));
    }

    @Test
    void openPositionIsClosedAtEndWithCosts() {
        StrategySpec strategy = strategy(List.of("AAPL"),
                new StrategyRule(RuleType.ENTRY, "momentum", Map.of("lookback", 5)));

        BacktestResult result = engine.run(strategy,
                Map.of("AAPL", TestBarFactory.trendingBars(40, 100, 1.0)), BacktestCosts.defaults());

        assertThat(result.tradeLog()).hasSize(2);
        Trade buy = result.tradeLog().get(0);
        assertThat(buy.timestamp()).isEqualTo(TestBarFactory.START.plusDays(5));
        assertThat(buy.quantity()).isEqualTo(18.87);
        assertThat(buy.price()).isCloseTo(106.0 * 1.0005, within(1e-9));
        assertThat(result.tradeLog().get(1).timestamp()).isEqualTo(TestBarFactory.START.plusDays(39));
        assertThat(result.metrics().totalReturn()).isPositive();
        assertThat(result.metrics().sharpe()).isPositive();
    }

    @Test
    void unknownIndicatorNeverTrades() {
        StrategySpec strategy = strategy(List.of("AAPL"), new StrategyRule(RuleType.ENTRY, "rsi", Map.of()));

        BacktestResult result = engine.run(strategy,
                Map.of("AAPL", TestBarFactory.trendingBars(30, 100, 1.0)), BacktestCosts.defaults());

        assertThat(result.tradeLog()).isEmpty();
        assertThat(result.equityCurve()).hasSize(30);
        assertThat(result.metrics().totalReturn()).isZero();
    }

    @Test
    void symbolsShareOneTimelineAndCashBalance() {
        StrategySpec strategy = new StrategySpec("multi", null, null, List.of("AAPL", "MSFT"),
                List.of(priceAbove(0)),
                new StrategyParams(PositionSizing.FIXED_SIZE, null, "1d"));

        BacktestResult result = engine.run(strategy, Map.of(
                "AAPL", TestBarFactory.flatBars(10, 100),
                "MSFT", TestBarFactory.flatBars(TestBarFactory.START.plusDays(5), 10, 50)), BacktestCosts.none());

        assertThat(result.equityCurve()).hasSize(15);
        assertThat(result.tradeLog()).filteredOn(trade -> trade.side() == OrderSide.BUY)
                .extracting(Trade::symbol, Trade::quantity)
                .containsExactly(
                        tuple("AAPL", 10.0),
                        tuple("MSFT", 20.0));
        assertThat(result.metrics().totalReturn()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    void periodsPerYearFollowsTimeframe() {
        assertThat(BacktestEngine.periodsPerYear("1d")).isEqualTo(252.0);
        assertThat(BacktestEngine.periodsPerYear("4h")).isEqualTo(252.0 * 6.5 / 4);
        assertThat(BacktestEngine.periodsPerYear("15m")).isEqualTo(252.0 * 390 / 15);
        assertThat(BacktestEngine.periodsPerYear("1w")).isEqualTo(52.0);
        assertThat(BacktestEngine.periodsPerYear("1mo")).isEqualTo(12.0);
        assertThat(BacktestEngine.periodsPerYear("weird")).isEqualTo(252.0);
    }

    private static StrategyRule priceAbove(double threshold) {
        return new StrategyRule(RuleType.ENTRY, "price", Map.of("threshold", threshold));
    }

    private static StrategySpec strategy(List<String> universe, StrategyRule... rules) {
        return new StrategySpec("test-strategy", "Test", null, universe, List.of(rules), StrategyParams.defaults());
    }
}
