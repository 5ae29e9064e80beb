package com.apex.gate.service.pipeline;

import com.apex.gate.config.DataQualityProperties;
import com.apex.gate.config.ExecutionProperties;
import com.apex.gate.config.PipelineProperties;
import com.apex.gate.exception.DataQualityException;
import com.apex.gate.exception.NoBrokerAvailableException;
import com.apex.gate.exception.TradingException;
import com.apex.gate.model.BacktestResult;
import com.apex.gate.model.Bar;
import com.apex.gate.model.Fill;
import com.apex.gate.model.GatingResult;
import com.apex.gate.model.Order;
import com.apex.gate.model.PortfolioState;
import com.apex.gate.model.QualityReport;
import com.apex.gate.model.QualityStatus;
import com.apex.gate.model.RiskAssessment;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.WalkForwardResult;
import com.apex.gate.service.BacktestEngine;
import com.apex.gate.service.DataQualityChecker;
import com.apex.gate.service.MetricsService;
import com.apex.gate.service.OrderGenerator;
import com.apex.gate.service.WalkForwardValidationService;
import com.apex.gate.service.broker.Broker;
import com.apex.gate.service.broker.BrokerManager;
import com.apex.gate.service.broker.OrderExecutionException;
import com.apex.gate.service.control.ActiveRunRegistry;
import com.apex.gate.service.control.ExecutionGuard;
import com.apex.gate.service.control.KillSwitchService;
import com.apex.gate.service.risk.RiskEngine;
import com.apex.gate.service.risk.RiskRequest;
import com.apex.gate.service.scenario.ScenarioGatingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one strategy candidate through quality screening, backtest, validation, scenario gating,
 * order synthesis, risk assessment and, when asked, execution. Decisions belong to the stages;
 * this class only sequences them and records what each produced.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyPipelineService {

    private final DataQualityChecker dataQualityChecker;
    private final BacktestEngine backtestEngine;
    private final WalkForwardValidationService walkForwardValidationService;
    private final ScenarioGatingService scenarioGatingService;
    private final OrderGenerator orderGenerator;
    private final RiskEngine riskEngine;
    private final BrokerManager brokerManager;
    private final ExecutionGuard executionGuard;
    private final KillSwitchService killSwitchService;
    private final ActiveRunRegistry activeRunRegistry;
    private final CandidateResultSink candidateResultSink;
    private final MetricsService metricsService;
    private final DataQualityProperties dataQualityProperties;
    private final PipelineProperties pipelineProperties;
    private final ExecutionProperties executionProperties;

    public CandidateResult evaluateAndExecute(StrategySpec strategy, Map<String, List<Bar>> marketData,
                                              PortfolioState portfolio, boolean shouldExecute) {
        return evaluateAndExecute(PipelineRequest.of(strategy, marketData, portfolio, shouldExecute));
    }

    public CandidateResult evaluateAndExecute(PipelineRequest request) {
        if (request == null || request.strategy() == null) {
            throw new IllegalArgumentException("A strategy is required to run the pipeline");
        }
        StrategySpec strategy = request.strategy();
        try {
            killSwitchService.ensureInactive();
        } catch (TradingException e) {
            metricsService.recordPipelineBlocked();
            log.warn("Run for strategy {} refused: {}", strategy.strategyId(), e.getMessage());
            throw e;
        }

        String runId = activeRunRegistry.start();
        MDC.put("runId", runId);
        MDC.put("strategyId", String.valueOf(strategy.strategyId()));
        log.info("PIPELINE START: strategy={} symbols={} execute={}", strategy.strategyId(),
                request.marketData().keySet(), request.shouldExecute());
        try {
            metricsService.recordPipelineRun();
            CandidateResult result = runStages(runId, request);
            persist(result);
            log.info("PIPELINE STOP: risk={} approved={} fills={} error={}",
                    result.risk().riskLevel(), result.risk().approvedTrades().size(),
                    result.executionFills().size(), result.executionError());
            return result;
        } finally {
            activeRunRegistry.finish(runId);
            MDC.clear();
        }
    }

    private CandidateResult runStages(String runId, PipelineRequest request) {
        StrategySpec strategy = request.strategy();
        Map<String, List<Bar>> marketData = request.marketData();

        Map<String, QualityReport> quality = dataQualityChecker.validateAll(marketData);
        enforceDataQuality(strategy, quality);

        BacktestResult backtest = backtestEngine.run(strategy, marketData, request.costs());

        WalkForwardResult validation = null;
        if (request.validationConfig().walkForward()) {
            validation = walkForwardValidationService.validate(strategy, marketData, request.costs(), request.validationConfig());
        }

        GatingResult gating = null;
        if (pipelineProperties.isScenarioGatingEnabled()) {
            gating = request.scenarios() != null
                    ? scenarioGatingService.evaluate(strategy, request.scenarios(), marketData, request.costs(), request.gatingRules())
                    : scenarioGatingService.evaluate(strategy, marketData, request.costs(), request.gatingRules());
            if (!gating.overallPassed()) {
                metricsService.recordGatingFailure();
            }
        }

        Map<String, Double> latestPrices = latestPrices(marketData);
        PortfolioState portfolio = request.portfolio() != null
                ? request.portfolio()
                : PortfolioState.cashOnly(pipelineProperties.getDefaultCash());

        List<Order> proposed = orderGenerator.generate(strategy, portfolio, latestPrices, backtest.tradeLog());
        RiskAssessment risk = assessRisk(strategy, portfolio, proposed, latestPrices, request);
        metricsService.recordRiskOutcome(risk.approvedTrades().size(), proposed.size() - risk.approvedTrades().size());

        List<Fill> fills = new ArrayList<>();
        String broker = null;
        String executionError = null;
        if (request.shouldExecute()) {
            ExecutionOutcome outcome = execute(gating, risk, latestPrices);
            fills.addAll(outcome.fills());
            broker = outcome.broker();
            executionError = outcome.error();
        }

        return new CandidateResult(runId, strategy, quality, backtest, validation, gating, proposed, risk,
                broker, fills, executionError);
    }

    private void enforceDataQuality(StrategySpec strategy, Map<String, QualityReport> quality) {
        List<String> failing = quality.entrySet().stream()
                .filter(entry -> entry.getValue().getOverallStatus() == QualityStatus.FAIL)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
        if (failing.isEmpty()) {
            return;
        }
        if (dataQualityProperties.isStrictMode()) {
            metricsService.recordPipelineBlocked();
            throw new DataQualityException("Data quality checks failed for " + failing
                    + " (data-quality.strict-mode is enabled)");
        }
        log.warn("Data quality failed for {} on strategy {}; continuing in advisory mode", failing, strategy.strategyId());
    }

    private RiskAssessment assessRisk(StrategySpec strategy, PortfolioState portfolio, List<Order> proposed,
                                      Map<String, Double> latestPrices, PipelineRequest request) {
        List<String> strategyViolations = riskEngine.checkStrategy(strategy);
        if (!strategyViolations.isEmpty()) {
            log.warn("Strategy {} rejected by risk checks: {}", strategy.strategyId(), strategyViolations);
            return RiskAssessment.blocked(strategyViolations);
        }
        return riskEngine.assess(new RiskRequest(portfolio, proposed, latestPrices, request.equityCurve(),
                request.averageDailyVolumes()));
    }

    private ExecutionOutcome execute(GatingResult gating, RiskAssessment risk, Map<String, Double> latestPrices) {
        if (gating != null && !gating.overallPassed() && pipelineProperties.isGatingRequiredForExecution()) {
            return ExecutionOutcome.failed(null, List.of(), "Execution blocked: scenario gating failed: "
                    + String.join("; ", gating.blockingViolations()));
        }
        Optional<String> guard = executionGuard.blockedReason();
        if (guard.isPresent()) {
            log.warn(guard.get());
            return ExecutionOutcome.failed(null, List.of(), guard.get());
        }
        if (risk.approvedTrades().isEmpty()) {
            log.info("No approved orders to execute");
            return new ExecutionOutcome(null, List.of(), null);
        }

        Broker broker;
        try {
            broker = brokerManager.getBroker();
        } catch (NoBrokerAvailableException e) {
            log.error("Execution skipped: {}", e.getMessage());
            return ExecutionOutcome.failed(null, List.of(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Broker selection failed", e);
            return ExecutionOutcome.failed(null, List.of(), "Broker selection failed: " + describe(e));
        }

        try {
            broker.onMarketPrices(latestPrices);
            List<Fill> fills = broker.executeOrders(risk.approvedTrades(), executionProperties.isVerifyFills(),
                    executionProperties.getFillTimeout());
            metricsService.recordOrdersFilled(fills.size());
            log.info("Executed {} orders on {} with {} fills", risk.approvedTrades().size(), broker.name(), fills.size());
            return new ExecutionOutcome(broker.name(), fills, null);
        } catch (OrderExecutionException e) {
            metricsService.recordOrdersFilled(e.getPartialFills().size());
            log.error("Execution on {} stopped after {} fills: {}", broker.name(), e.getPartialFills().size(), e.getMessage());
            return ExecutionOutcome.failed(broker.name(), e.getPartialFills(), e.getMessage());
        } catch (TradingException e) {
            log.error("Execution on {} failed: {}", broker.name(), e.getMessage());
            return ExecutionOutcome.failed(broker.name(), List.of(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected failure executing on {}", broker.name(), e);
            return ExecutionOutcome.failed(broker.name(), List.of(),
                    "Execution on " + broker.name() + " failed: " + describe(e));
        }
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    private void persist(CandidateResult result) {
        try {
            candidateResultSink.save(result);
        } catch (RuntimeException e) {
            log.warn("Failed to persist candidate result {}: {}", result.runId(), e.getMessage());
        }
    }

    static Map<String, Double> latestPrices(Map<String, List<Bar>> marketData) {
        Map<String, Double> prices = new LinkedHashMap<>();
        marketData.forEach((symbol, bars) -> {
            if (bars == null) {
                return;
            }
            bars.stream()
                    .filter(bar -> bar.getTimestamp() != null && bar.getClose() != null)
                    .max(Comparator.comparing(Bar::getTimestamp))
                    .ifPresent(bar -> prices.put(symbol, bar.getClose()));
        });
        return prices;
    }

    private record ExecutionOutcome(String broker, List<Fill> fills, String error) {
        static ExecutionOutcome failed(String broker, List<Fill> fills, String error) {
            return new ExecutionOutcome(broker, fills, error);
        }
    }
}
