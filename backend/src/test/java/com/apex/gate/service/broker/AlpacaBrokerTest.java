package com.apex.gate.service.broker;

import com.apex.gate.config.AlpacaHttpConfig;
import com.apex.gate.config.AlpacaProperties;
import com.apex.gate.config.BrokerProperties;
import com.apex.gate.config.BrokerResilienceConfig;
import com.apex.gate.config.ExecutionProperties;
import com.apex.gate.exception.ProviderAuthException;
import com.apex.gate.model.Fill;
import com.apex.gate.model.Order;
import com.apex.gate.model.OrderSide;
import com.apex.gate.service.DelayScheduler;
import com.apex.gate.service.MetricsService;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.delete;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.matchingJsonPath;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class AlpacaBrokerTest {

    private static final String FILLED_ORDER = """
            {"id":"o-1","symbol":"AAPL","side":"buy","status":"filled","qty":"10","filled_qty":"10",
             "filled_avg_price":"150.25","submitted_at":"2024-03-01T15:00:00Z","filled_at":"2024-03-01T15:00:01Z"}
            """;

    private WireMockServer wireMock;
    private AlpacaBroker broker;

    @BeforeEach
    void setUp() {
        wireMock = new WireMockServer(0);
        wireMock.start();

        AlpacaProperties alpacaProperties = new AlpacaProperties();
        alpacaProperties.setBaseUrl("http://localhost:" + wireMock.port());
        alpacaProperties.setApiKey("key-id");
        alpacaProperties.setApiSecret("secret-key");

        BrokerProperties brokerProperties = new BrokerProperties();
        brokerProperties.getRetry().setBaseDelay(Duration.ofMillis(10));
        brokerProperties.getRetry().setMaxDelay(Duration.ofMillis(50));
        brokerProperties.getRateLimit().setLimitPerSecond(100);

        AlpacaHttpClient httpClient = new AlpacaHttpClient(
                AlpacaHttpConfig.restTemplate(alpacaProperties.getHttp()),
                BrokerResilienceConfig.retry("alpaca-test", brokerProperties.getRetry()),
                BrokerResilienceConfig.circuitBreaker("alpaca-test", brokerProperties.getCircuitBreaker()),
                BrokerResilienceConfig.rateLimiter("alpaca-test", brokerProperties.getRateLimit()),
                alpacaProperties,
                mock(MetricsService.class));

        ExecutionProperties executionProperties = new ExecutionProperties();
        executionProperties.setPollInterval(Duration.ofMillis(20));

        broker = new AlpacaBroker(httpClient, alpacaProperties, executionProperties, new DelayScheduler(), new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        wireMock.stop();
    }

    @Test
    void sendsCredentialHeadersAndParsesAccount() {
        wireMock.stubFor(get(urlEqualTo("/v2/account"))
                .withHeader("APCA-API-KEY-ID", equalTo("key-id"))
                .withHeader("APCA-API-SECRET-KEY", equalTo("secret-key"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":\"acc-1\",\"status\":\"ACTIVE\",\"cash\":\"25000.5\",\"equity\":\"30000\","
                                + "\"buying_power\":\"50000\",\"trading_blocked\":false,\"pattern_day_trader\":true}")));

        BrokerAccount account = broker.getAccount();

        assertThat(account.status()).isEqualTo("ACTIVE");
        assertThat(account.cash()).isEqualTo(25000.5);
        assertThat(account.equity()).isEqualTo(30000.0);
        assertThat(account.patternDayTrader()).isTrue();
    }

    @Test
    void rateLimitedSubmissionIsRetried() {
        wireMock.stubFor(post(urlEqualTo("/v2/orders"))
                .inScenario("rate-limit")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(429).withBody("{\"message\":\"too many requests\"}"))
                .willSetStateTo("recovered"));
        wireMock.stubFor(post(urlEqualTo("/v2/orders"))
                .inScenario("rate-limit")
                .whenScenarioStateIs("recovered")
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody(FILLED_ORDER)));

        List<Fill> fills = broker.executeOrders(List.of(Order.market("AAPL", OrderSide.BUY, 10)), true, Duration.ofSeconds(1));

        assertThat(fills).hasSize(1);
        assertThat(fills.get(0).orderId()).isEqualTo("o-1");
        assertThat(fills.get(0).price()).isEqualTo(150.25);
        wireMock.verify(2, postRequestedFor(urlEqualTo("/v2/orders"))
                .withRequestBody(matchingJsonPath("$.symbol", equalTo("AAPL")))
                .withRequestBody(matchingJsonPath("$.side", equalTo("buy")))
                .withRequestBody(matchingJsonPath("$.type", equalTo("market"))));
    }

    @Test
    void unverifiedSubmissionIsAcknowledgedWithoutPrice() {
        wireMock.stubFor(post(urlEqualTo("/v2/orders"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":\"o-9\",\"symbol\":\"AAPL\",\"side\":\"buy\",\"status\":\"accepted\",\"qty\":\"3\","
                                + "\"submitted_at\":\"2024-03-01T15:00:00Z\"}")));

        List<Fill> fills = broker.executeOrders(List.of(Order.market("AAPL", OrderSide.BUY, 3)), false, Duration.ZERO);

        assertThat(fills).singleElement().satisfies(fill -> {
            assertThat(fill.orderId()).isEqualTo("o-9");
            assertThat(fill.quantity()).isEqualTo(3.0);
            assertThat(fill.price()).isZero();
        });
        wireMock.verify(0, getRequestedFor(urlEqualTo("/v2/orders/o-9")));
    }

    @Test
    void authenticationFailureIsNotRetried() {
        wireMock.stubFor(get(urlEqualTo("/v2/account"))
                .willReturn(aResponse().withStatus(401).withBody("{\"message\":\"unauthorized\"}")));

        assertThatThrownBy(() -> broker.getAccount())
                .isInstanceOf(ProviderAuthException.class)
                .hasMessageContaining("alpaca.api-key");
        wireMock.verify(1, getRequestedFor(urlEqualTo("/v2/account")));
    }

    @Test
    void serverErrorsExhaustRetriesAndFailSubmission() {
        wireMock.stubFor(post(urlEqualTo("/v2/orders"))
                .willReturn(aResponse().withStatus(503).withBody("unavailable")));

        assertThatThrownBy(() -> broker.executeOrders(List.of(Order.market("AAPL", OrderSide.BUY, 10)), false, Duration.ZERO))
                .isInstanceOf(OrderExecutionException.class)
                .hasMessageContaining("AAPL")
                .satisfies(e -> assertThat(((OrderExecutionException) e).getPartialFills()).isEmpty());
        wireMock.verify(3, postRequestedFor(urlEqualTo("/v2/orders")));
    }

    @Test
    void cancelOfUnknownOrderReturnsFalse() {
        wireMock.stubFor(delete(urlEqualTo("/v2/orders/missing"))
                .willReturn(aResponse().withStatus(404).withBody("{\"message\":\"order not found\"}")));
        wireMock.stubFor(delete(urlEqualTo("/v2/orders/o-2"))
                .willReturn(aResponse().withStatus(204)));

        assertThat(broker.cancelOrder("missing")).isFalse();
        assertThat(broker.cancelOrder("o-2")).isTrue();
    }

    @Test
    void cancelAllReportsPerOrderOutcome() {
        wireMock.stubFor(get(urlEqualTo("/v2/orders?status=open"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("[{\"id\":\"o-2\"},{\"id\":\"o-3\"}]")));
        wireMock.stubFor(delete(urlEqualTo("/v2/orders/o-2")).willReturn(aResponse().withStatus(204)));
        wireMock.stubFor(delete(urlEqualTo("/v2/orders/o-3"))
                .willReturn(aResponse().withStatus(422).withBody("{\"message\":\"already filled\"}")));

        CancelAllResult result = broker.cancelAllOrders();

        assertThat(result.cancelledCount()).isEqualTo(1);
        assertThat(result.totalOrders()).isEqualTo(2);
        assertThat(result.errors()).singleElement().asString().contains("o-3");
    }

    @Test
    void fillVerificationTimesOutToEmpty() {
        wireMock.stubFor(get(urlEqualTo("/v2/orders/o-4"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":\"o-4\",\"symbol\":\"AAPL\",\"side\":\"buy\",\"status\":\"new\",\"qty\":\"5\"}")));

        Optional<Fill> fill = broker.verifyFill("o-4", Duration.ofMillis(150), Duration.ofMillis(20));

        assertThat(fill).isEmpty();
        assertThat(wireMock.findAll(getRequestedFor(urlEqualTo("/v2/orders/o-4")))).hasSizeGreaterThan(1);
    }

    @Test
    void fillVerificationStopsOnCancelledOrder() {
        wireMock.stubFor(get(urlEqualTo("/v2/orders/o-5"))
                .willReturn(aResponse().withStatus(200)
                        .withHeader("Content-Type", "application/json")
                        .withBody("{\"id\":\"o-5\",\"symbol\":\"AAPL\",\"side\":\"buy\",\"status\":\"canceled\",\"qty\":\"5\"}")));

        assertThat(broker.verifyFill("o-5", Duration.ofSeconds(5), Duration.ofMillis(20))).isEmpty();
        wireMock.verify(1, getRequestedFor(urlEqualTo("/v2/orders/o-5")));
    }

    @Test
    void healthCheckFailsOnRejectedCredentials() {
        wireMock.stubFor(get(urlEqualTo("/v2/account"))
                .willReturn(aResponse().withStatus(403).withBody("{\"message\":\"forbidden\"}")));

        assertThat(broker.healthCheck()).isFalse();
        assertThat(broker.getHealthStatus().healthy()).isFalse();
    }
}
