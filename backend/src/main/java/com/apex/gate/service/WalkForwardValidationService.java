package com.apex.gate.service;

import com.apex.gate.config.ValidationProperties;
import com.apex.gate.exception.ConfigurationException;
import com.apex.gate.model.BacktestCosts;
import com.apex.gate.model.BacktestMetrics;
import com.apex.gate.model.BacktestResult;
import com.apex.gate.model.Bar;
import com.apex.gate.model.DataSplit;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.ValidationConfig;
import com.apex.gate.model.WalkForwardResult;
import com.apex.gate.model.WalkForwardWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

@Service
@Slf4j
@RequiredArgsConstructor
public class WalkForwardValidationService {

    private final ValidationProperties properties;
    private final BacktestEngine backtestEngine;

    /**
     * Cuts every symbol's bars chronologically into train, validation and holdout partitions.
     *
     * @throws ConfigurationException if the fractions do not sum to one
     */
    public DataSplit split(Map<String, List<Bar>> barsBySymbol, double train, double validation, double holdout) {
        double total = train + validation + holdout;
        if (Math.abs(total - 1.0) > properties.getSplitTolerance()) {
            throw new ConfigurationException(String.format(
                    "Split fractions must sum to 1.0, got %.4f (train=%.2f, validation=%.2f, holdout=%.2f)",
                    total, train, validation, holdout));
        }
        Map<String, List<Bar>> trainBars = new LinkedHashMap<>();
        Map<String, List<Bar>> validationBars = new LinkedHashMap<>();
        Map<String, List<Bar>> holdoutBars = new LinkedHashMap<>();
        barsBySymbol.forEach((symbol, bars) -> {
            List<Bar> sorted = sorted(bars);
            int n = sorted.size();
            int trainEnd = (int) (n * train);
            int validationEnd = Math.max(trainEnd, Math.min(n, (int) (n * (train + validation))));
            trainBars.put(symbol, List.copyOf(sorted.subList(0, trainEnd)));
            validationBars.put(symbol, List.copyOf(sorted.subList(trainEnd, validationEnd)));
            holdoutBars.put(symbol, List.copyOf(sorted.subList(validationEnd, n)));
        });
        return new DataSplit(trainBars, validationBars, holdoutBars);
    }

    public List<WalkForwardWindow> windows(LocalDateTime start, LocalDateTime end, Integer windowSizeDays,
                                           boolean expanding, int stepSizeDays) {
        List<WalkForwardWindow> windows = new ArrayList<>();
        if (start == null || end == null || !start.isBefore(end)) {
            return windows;
        }
        long totalDays = Duration.between(start, end).toDays();
        int minTrainDays = properties.getMinTrainDays();
        if (totalDays < minTrainDays) {
            log.warn("Date range is very short ({} days), walk-forward may not produce windows", totalDays);
        }
        long trainDays = windowSizeDays != null ? windowSizeDays : (long) (totalDays * properties.getInitialTrainFraction());
        trainDays = Math.max(trainDays, minTrainDays);
        long testDays = Math.max((long) (totalDays * properties.getTestFraction()), properties.getMinTestDays());
        int step = Math.max(1, stepSizeDays);

        LocalDateTime testStart = expanding ? start : start.plusDays(trainDays);
        while (testStart.isBefore(end)) {
            LocalDateTime trainStart = expanding ? start : testStart.minusDays(trainDays);
            LocalDateTime testEnd = testStart.plusDays(testDays);
            if (testEnd.isAfter(end)) {
                testEnd = end;
            }
            if (!testEnd.isAfter(testStart)) {
                break;
            }
            if (Duration.between(trainStart, testStart).toDays() >= minTrainDays) {
                windows.add(new WalkForwardWindow(trainStart, testStart, testStart, testEnd));
                if (!testEnd.isBefore(end)) {
                    break;
                }
            }
            testStart = testStart.plusDays(step);
        }
        return windows;
    }

    public WalkForwardResult validate(StrategySpec strategy, Map<String, List<Bar>> barsBySymbol,
                                      BacktestCosts costs, ValidationConfig config) {
        ValidationConfig effective = config != null ? config : ValidationConfig.singleBacktest();
        if (!effective.walkForward()) {
            return single(backtestEngine.run(strategy, barsBySymbol, costs));
        }
        if (effective.splitTotal() > 0) {
            return validateSplits(strategy, barsBySymbol, costs, effective);
        }
        return validateWindows(strategy, barsBySymbol, costs, effective);
    }

    private WalkForwardResult validateSplits(StrategySpec strategy, Map<String, List<Bar>> barsBySymbol,
                                             BacktestCosts costs, ValidationConfig config) {
        DataSplit split = split(barsBySymbol, config.trainSplit(), config.validationSplit(), config.holdoutSplit());
        BacktestResult train = backtestEngine.run(strategy, split.train(), costs);
        BacktestResult validation = backtestEngine.run(strategy, split.validation(), costs);
        List<BacktestResult> results = new ArrayList<>(List.of(train, validation));
        BacktestMetrics holdoutMetrics = null;
        if (config.holdoutSplit() > 0) {
            BacktestResult holdout = backtestEngine.run(strategy, split.holdout(), costs);
            results.add(holdout);
            holdoutMetrics = holdout.metrics();
        }
        log.info("Split validation for {}: train sharpe={}, validation sharpe={}",
                strategy.strategyId(), train.metrics().sharpe(), validation.metrics().sharpe());
        return new WalkForwardResult(results, aggregate(results), train.metrics(), validation.metrics(), holdoutMetrics);
    }

    private WalkForwardResult validateWindows(StrategySpec strategy, Map<String, List<Bar>> barsBySymbol,
                                              BacktestCosts costs, ValidationConfig config) {
        LocalDateTime start = barsBySymbol.values().stream()
                .flatMap(List::stream)
                .map(Bar::getTimestamp)
                .filter(Objects::nonNull)
                .min(Comparator.naturalOrder())
                .orElse(null);
        LocalDateTime end = barsBySymbol.values().stream()
                .flatMap(List::stream)
                .map(Bar::getTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        List<WalkForwardWindow> windows = windows(start, end, config.windowSizeDays(), config.expanding(), config.stepSizeDays());
        if (windows.isEmpty()) {
            log.warn("No walk-forward windows for {}, falling back to a single backtest", strategy.strategyId());
            return single(backtestEngine.run(strategy, barsBySymbol, costs));
        }
        List<BacktestResult> results = new ArrayList<>();
        for (WalkForwardWindow window : windows) {
            results.add(backtestEngine.run(strategy, slice(barsBySymbol, window.testStart(), window.testEnd()), costs));
        }
        log.info("Walk-forward validation for {} over {} windows", strategy.strategyId(), windows.size());
        return new WalkForwardResult(results, aggregate(results),
                results.get(0).metrics(), results.get(results.size() - 1).metrics(), null);
    }

    /**
     * Unweighted mean across windows; windows of different lengths count equally.
     */
    BacktestMetrics aggregate(List<BacktestResult> results) {
        if (results.isEmpty()) {
            return BacktestMetrics.zero();
        }
        double sharpe = results.stream().mapToDouble(r -> r.metrics().sharpe()).average().orElse(0.0);
        double drawdown = results.stream().mapToDouble(r -> r.metrics().maxDrawdown()).average().orElse(0.0);
        Double totalReturn = results.stream().allMatch(r -> r.metrics().totalReturn() != null)
                ? results.stream().mapToDouble(r -> r.metrics().totalReturn()).average().orElse(0.0)
                : null;
        return new BacktestMetrics(sharpe, drawdown, totalReturn);
    }

    private WalkForwardResult single(BacktestResult result) {
        return new WalkForwardResult(List.of(result), result.metrics(), result.metrics(), result.metrics(), null);
    }

    static Map<String, List<Bar>> slice(Map<String, List<Bar>> barsBySymbol, LocalDateTime from, LocalDateTime to) {
        Map<String, List<Bar>> sliced = new LinkedHashMap<>();
        barsBySymbol.forEach((symbol, bars) -> sliced.put(symbol, bars.stream()
                .filter(bar -> bar.getTimestamp() != null)
                .filter(bar -> !bar.getTimestamp().isBefore(from) && !bar.getTimestamp().isAfter(to))
                .toList()));
        return sliced;
    }

    private static List<Bar> sorted(List<Bar> bars) {
        if (bars == null) {
            return List.of();
        }
        return bars.stream()
                .sorted(Comparator.comparing(Bar::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }
}
