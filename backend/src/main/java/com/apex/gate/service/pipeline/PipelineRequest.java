package com.apex.gate.service.pipeline;

import com.apex.gate.model.BacktestCosts;
import com.apex.gate.model.Bar;
import com.apex.gate.model.GatingRule;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.model.Scenario;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.ValidationConfig;
import lombok.Builder;

import java.util.List;
import java.util.Map;

/**
 * One pipeline invocation.
 *
 * @param portfolio           current holdings; null uses a cash-only portfolio of {@code pipeline.default-cash}
 * @param gatingRules         null uses the default gating rules
 * @param scenarios           null gates against every registered scenario
 * @param equityCurve         live account equity history for the drawdown breaker, optional
 * @param averageDailyVolumes enables the liquidity check when present
 */
@Builder
public record PipelineRequest(
        StrategySpec strategy,
        Map<String, List<Bar>> marketData,
        PortfolioState portfolio,
        boolean shouldExecute,
        ValidationConfig validationConfig,
        BacktestCosts costs,
        List<GatingRule> gatingRules,
        List<Scenario> scenarios,
        List<Double> equityCurve,
        Map<String, Double> averageDailyVolumes
) {

    public PipelineRequest {
        marketData = marketData == null ? Map.of() : marketData;
        costs = costs == null ? BacktestCosts.defaults() : costs;
        validationConfig = validationConfig == null ? ValidationConfig.singleBacktest() : validationConfig;
    }

    public static PipelineRequest of(StrategySpec strategy, Map<String, List<Bar>> marketData,
                                     PortfolioState portfolio, boolean shouldExecute) {
        return PipelineRequest.builder()
                .strategy(strategy)
                .marketData(marketData)
                .portfolio(portfolio)
                .shouldExecute(shouldExecute)
                .build();
    }
}
