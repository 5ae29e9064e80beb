package com.apex.gate.service.indicator;

import com.apex.gate.model.StrategyRule;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Set;

@Service
public class IndicatorService {

    public static final int DEFAULT_WINDOW = 20;
    public static final int DEFAULT_FAST_WINDOW = 10;
    public static final int DEFAULT_SLOW_WINDOW = 20;
    public static final int DEFAULT_LOOKBACK = 5;

    private static final Set<String> SUPPORTED = Set.of("price", "sma", "ema", "returns", "zscore", "momentum", "crossover");

    public boolean supports(String indicator) {
        return indicator != null && SUPPORTED.contains(normalize(indicator));
    }

    /**
     * Evaluates the named indicator over a close series.
     *
     * @throws IllegalArgumentException if the indicator is not known
     */
    public double[] evaluate(String indicator, double[] closes, StrategyRule rule) {
        int window = rule.intParam("window", DEFAULT_WINDOW);
        return switch (normalize(indicator)) {
            case "price" -> closes.clone();
            case "sma" -> Indicators.sma(closes, window);
            case "ema" -> Indicators.ema(closes, window);
            case "returns" -> Indicators.returns(closes);
            case "zscore" -> Indicators.zscore(Indicators.returns(closes), window);
            case "momentum" -> Indicators.momentum(closes, rule.intParam("lookback", DEFAULT_LOOKBACK));
            case "crossover" -> spread(
                    Indicators.sma(closes, rule.intParam("fast_window", DEFAULT_FAST_WINDOW)),
                    Indicators.sma(closes, rule.intParam("slow_window", DEFAULT_SLOW_WINDOW)));
            default -> throw new IllegalArgumentException("Unknown indicator: " + indicator);
        };
    }

    /**
     * Binds a rule to one symbol's close series so it can be asked whether it fires at a bar index.
     */
    public RuleSignal compile(StrategyRule rule, double[] closes) {
        String indicator = normalize(rule.indicator());
        double[] values = evaluate(indicator, closes, rule);
        boolean priceDefault = indicator.equals("sma") || indicator.equals("ema");
        String compareTo = rule.stringParam("compare_to", priceDefault ? "price" : "threshold");
        return new RuleSignal(
                values,
                closes,
                "below".equalsIgnoreCase(rule.stringParam("direction", "above")),
                rule.doubleParam("threshold", 0.0),
                "price".equalsIgnoreCase(compareTo),
                rule.booleanParam("cross", false));
    }

    private static double[] spread(double[] fast, double[] slow) {
        double[] result = new double[fast.length];
        for (int i = 0; i < fast.length; i++) {
            result[i] = fast[i] - slow[i];
        }
        return result;
    }

    private static String normalize(String indicator) {
        return indicator == null ? "" : indicator.trim().toLowerCase(Locale.ROOT);
    }

    public record RuleSignal(double[] values, double[] closes, boolean below, double threshold,
                             boolean compareToPrice, boolean requireCross) {

        public boolean firesAt(int index) {
            if (!conditionAt(index)) {
                return false;
            }
            return !requireCross || (index > 0 && !conditionAt(index - 1));
        }

        private boolean conditionAt(int index) {
            if (index < 0 || index >= values.length || Double.isNaN(values[index])) {
                return false;
            }
            double left = compareToPrice ? closes[index] : values[index];
            double right = compareToPrice ? values[index] : threshold;
            return below ? left < right : left > right;
        }
    }
}
