package com.apex.gate.service.pipeline;

import com.apex.gate.config.BacktestProperties;
import com.apex.gate.config.BrokerProperties;
import com.apex.gate.config.DataQualityProperties;
import com.apex.gate.config.ExecutionProperties;
import com.apex.gate.config.PipelineProperties;
import com.apex.gate.config.RiskProperties;
import com.apex.gate.config.ValidationProperties;
import com.apex.gate.exception.DataQualityException;
import com.apex.gate.exception.KillSwitchActiveException;
import com.apex.gate.exception.ProviderAuthException;
import com.apex.gate.model.Bar;
import com.apex.gate.model.Fill;
import com.apex.gate.model.Order;
import com.apex.gate.model.OrderSide;
import com.apex.gate.model.QualityStatus;
import com.apex.gate.model.RiskLevel;
import com.apex.gate.model.StrategySpec;
import com.apex.gate.model.ValidationConfig;
import com.apex.gate.service.BacktestEngine;
import com.apex.gate.service.DataQualityChecker;
import com.apex.gate.service.MetricsService;
import com.apex.gate.service.OrderGenerator;
import com.apex.gate.service.WalkForwardValidationService;
import com.apex.gate.service.broker.BrokerManager;
import com.apex.gate.service.broker.BrokerRegistry;
import com.apex.gate.service.broker.PaperBroker;
import com.apex.gate.service.control.ActiveRunRegistry;
import com.apex.gate.service.control.ExecutionGuard;
import com.apex.gate.service.control.KillSwitchService;
import com.apex.gate.service.indicator.IndicatorService;
import com.apex.gate.service.risk.DefaultRiskEngine;
import com.apex.gate.service.scenario.ScenarioGatingService;
import com.apex.gate.service.scenario.ScenarioRegistry;
import com.apex.gate.util.TestBarFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class StrategyPipelineServiceTest {

    private static final StrategySpec STRATEGY = new StrategySpec("s-1", "hold", null, List.of("AAPL"), List.of(), null);

    private final DataQualityProperties dataQualityProperties = new DataQualityProperties();
    private final PipelineProperties pipelineProperties = new PipelineProperties();
    private final ExecutionProperties executionProperties = new ExecutionProperties();
    private final MetricsService metricsService = mock(MetricsService.class);
    private final KillSwitchService killSwitchService = new KillSwitchService();
    private final ActiveRunRegistry activeRunRegistry = new ActiveRunRegistry();
    private final List<CandidateResult> saved = new ArrayList<>();
    private CandidateResultSink sink = saved::add;
    private PaperBroker paper = new PaperBroker(100_000);
    private StrategyPipelineService pipeline;

    // 60 daily bars closing 100.5 .. 130.0
    private final Map<String, List<Bar>> marketData = Map.of("AAPL", TestBarFactory.trendingBars(60, 100, 0.5));

    @BeforeEach
    void setup() {
        executionProperties.setEnvironment("test");
        executionProperties.setFillTimeout(Duration.ofSeconds(1));
        pipeline = build();
    }

    private StrategyPipelineService build() {
        BacktestProperties backtestProperties = new BacktestProperties();
        BacktestEngine backtestEngine = new BacktestEngine(backtestProperties, new IndicatorService());
        BrokerProperties brokerProperties = new BrokerProperties();
        brokerProperties.setPrimary("paper");
        brokerProperties.setFailoverEnabled(false);
        brokerProperties.setHealthCheckTimeout(Duration.ofSeconds(1));
        BrokerRegistry registry = new BrokerRegistry().register("paper", () -> paper);

        return new StrategyPipelineService(
                new DataQualityChecker(dataQualityProperties),
                backtestEngine,
                new WalkForwardValidationService(new ValidationProperties(), backtestEngine),
                new ScenarioGatingService(backtestEngine, new ScenarioRegistry()),
                new OrderGenerator(backtestProperties),
                new DefaultRiskEngine(new RiskProperties()),
                new BrokerManager(registry, brokerProperties, metricsService),
                new ExecutionGuard(executionProperties),
                killSwitchService,
                activeRunRegistry,
                result -> sink.save(result),
                metricsService,
                dataQualityProperties,
                pipelineProperties,
                executionProperties);
    }

    @Test
    void evaluatesCandidateWithoutExecuting() {
        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, false);

        assertThat(result.runId()).isNotBlank();
        assertThat(result.dataQuality().get("AAPL").getOverallStatus()).isEqualTo(QualityStatus.PASS);
        assertThat(result.backtest().tradeLog()).isEmpty();
        assertThat(result.backtest().metrics().totalReturn()).isCloseTo(0.0, within(1e-9));
        assertThat(result.backtest().metrics().maxDrawdown()).isCloseTo(0.0, within(1e-9));
        assertThat(result.validation()).isNull();
        assertThat(result.gating()).isNotNull();
        assertThat(result.proposedOrders()).singleElement().satisfies(order -> {
            assertThat(order.symbol()).isEqualTo("AAPL");
            assertThat(order.side()).isEqualTo(OrderSide.BUY);
            assertThat(order.quantity()).isEqualTo(15.38);
        });
        assertThat(result.risk().approvedTrades()).hasSize(1);
        assertThat(result.risk().violations()).isEmpty();
        assertThat(result.executionFills()).isEmpty();
        assertThat(result.executionError()).isNull();
        assertThat(saved).containsExactly(result);
        assertThat(activeRunRegistry.count()).isZero();
        assertThat(MDC.get("runId")).isNull();
        verify(metricsService).recordPipelineRun();
        verify(metricsService).recordRiskOutcome(1, 0);
    }

    @Test
    void flatMarketYieldsFlatMetricsAndFractionSizedBuy() {
        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY,
                Map.of("AAPL", TestBarFactory.flatBars(60, 150)), null, false);

        assertThat(result.backtest().metrics().totalReturn()).isCloseTo(0.0, within(1e-9));
        assertThat(result.backtest().metrics().maxDrawdown()).isCloseTo(0.0, within(1e-9));
        assertThat(result.proposedOrders()).singleElement().satisfies(order -> {
            assertThat(order.side()).isEqualTo(OrderSide.BUY);
            assertThat(order.quantity()).isCloseTo(2000.0 / 150, within(0.01));
        });
    }

    @Test
    void killSwitchRefusesRunBeforeAnyWork() {
        killSwitchService.enable("incident");

        assertThatThrownBy(() -> pipeline.evaluateAndExecute(STRATEGY, marketData, null, true))
                .isInstanceOf(KillSwitchActiveException.class)
                .hasMessageContaining("incident");
        assertThat(saved).isEmpty();
        verify(metricsService).recordPipelineBlocked();
        verify(metricsService, never()).recordPipelineRun();
    }

    @Test
    void missingStrategyIsRejected() {
        assertThatThrownBy(() -> pipeline.evaluateAndExecute(null, marketData, null, false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void failedGatingBlocksExecution() {
        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.gating().overallPassed()).isFalse();
        assertThat(result.executionError()).startsWith("Execution blocked: scenario gating failed");
        assertThat(result.executed()).isFalse();
        assertThat(result.risk().approvedTrades()).hasSize(1);
        verify(metricsService).recordGatingFailure();
    }

    @Test
    void executionGuardBlocksOutsideProduction() {
        pipelineProperties.setScenarioGatingEnabled(false);

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.gating()).isNull();
        assertThat(result.executionError()).contains("ALLOW_EXECUTE");
        assertThat(result.broker()).isNull();
        assertThat(result.executionFills()).isEmpty();
    }

    @Test
    void approvedOrdersExecuteOnPaperBroker() {
        pipelineProperties.setScenarioGatingEnabled(false);
        executionProperties.setAllowExecute(true);

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.executionError()).isNull();
        assertThat(result.broker()).isEqualTo("paper");
        assertThat(result.executionFills()).singleElement().satisfies(fill -> {
            assertThat(fill.symbol()).isEqualTo("AAPL");
            assertThat(fill.quantity()).isEqualTo(15.38);
            assertThat(fill.price()).isEqualTo(130.0);
        });
        assertThat(result.executed()).isTrue();
        verify(metricsService).recordOrdersFilled(1);
    }

    @Test
    void unavailableBrokerIsReportedAndEarlierStagesSurvive() {
        pipelineProperties.setScenarioGatingEnabled(false);
        executionProperties.setAllowExecute(true);
        paper.setAvailable(false);

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.executionError()).contains("No available broker");
        assertThat(result.broker()).isNull();
        assertThat(result.backtest()).isNotNull();
        assertThat(result.risk().approvedTrades()).hasSize(1);
        assertThat(saved).containsExactly(result);
    }

    @Test
    void rejectedCredentialsBecomeExecutionError() {
        pipelineProperties.setScenarioGatingEnabled(false);
        executionProperties.setAllowExecute(true);
        paper = new PaperBroker(100_000) {
            @Override
            public List<Fill> executeOrders(List<Order> orders, boolean verifyFills, Duration fillTimeout) {
                throw new ProviderAuthException("Alpaca rejected the API credentials (401)");
            }
        };

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.executionError()).contains("credentials");
        assertThat(result.broker()).isEqualTo("paper");
        assertThat(result.executionFills()).isEmpty();
        assertThat(result.risk().approvedTrades()).hasSize(1);
    }

    @Test
    void unexpectedBrokerFailureBecomesExecutionError() {
        pipelineProperties.setScenarioGatingEnabled(false);
        executionProperties.setAllowExecute(true);
        paper = new PaperBroker(100_000) {
            @Override
            public List<Fill> executeOrders(List<Order> orders, boolean verifyFills, Duration fillTimeout) {
                throw new IllegalStateException("venue unreachable");
            }
        };

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.executionError()).contains("paper").contains("venue unreachable");
        assertThat(result.backtest()).isNotNull();
        assertThat(result.risk().approvedTrades()).hasSize(1);
        assertThat(saved).containsExactly(result);
        assertThat(activeRunRegistry.count()).isZero();
    }

    @Test
    void gatingFailureCanBeAdvisory() {
        pipelineProperties.setGatingRequiredForExecution(false);
        executionProperties.setAllowExecute(true);

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, true);

        assertThat(result.gating().overallPassed()).isFalse();
        assertThat(result.executed()).isTrue();
    }

    @Test
    void strictDataQualityStopsRun() {
        dataQualityProperties.setStrictMode(true);

        assertThatThrownBy(() -> pipeline.evaluateAndExecute(STRATEGY, brokenData(), null, false))
                .isInstanceOf(DataQualityException.class)
                .hasMessageContaining("AAPL")
                .hasMessageContaining("strict-mode");
        assertThat(activeRunRegistry.count()).isZero();
        assertThat(saved).isEmpty();
    }

    @Test
    void advisoryDataQualityKeepsGoing() {
        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, brokenData(), null, false);

        assertThat(result.dataQuality().get("AAPL").getOverallStatus()).isEqualTo(QualityStatus.FAIL);
        assertThat(result.backtest()).isNotNull();
        assertThat(result.risk()).isNotNull();
    }

    @Test
    void walkForwardRunsWhenRequested() {
        PipelineRequest request = PipelineRequest.builder()
                .strategy(STRATEGY)
                .marketData(marketData)
                .validationConfig(ValidationConfig.splits(0.7, 0.15, 0.15))
                .build();

        CandidateResult result = pipeline.evaluateAndExecute(request);

        assertThat(result.validation()).isNotNull();
    }

    @Test
    void strategyOutsideRiskLimitsIsBlocked() {
        StrategySpec empty = new StrategySpec("s-2", null, null, List.of(), List.of(), null);

        CandidateResult result = pipeline.evaluateAndExecute(empty, marketData, null, false);

        assertThat(result.risk().riskLevel()).isEqualTo(RiskLevel.BLOCK);
        assertThat(result.risk().approvedTrades()).isEmpty();
        assertThat(result.risk().violations()).anyMatch(violation -> violation.contains("empty universe"));
    }

    @Test
    void sinkFailureDoesNotFailRun() {
        sink = result -> {
            throw new IllegalStateException("disk full");
        };

        CandidateResult result = pipeline.evaluateAndExecute(STRATEGY, marketData, null, false);

        assertThat(result.risk().approvedTrades()).hasSize(1);
    }

    private static Map<String, List<Bar>> brokenData() {
        List<Bar> bars = new ArrayList<>(TestBarFactory.trendingBars(60, 100, 0.5));
        Bar bad = bars.get(10);
        bars.set(10, TestBarFactory.bar(bad.getTimestamp(), 105, 100, 110, 105, 1_000_000L));
        return Map.of("AAPL", bars);
    }
}
