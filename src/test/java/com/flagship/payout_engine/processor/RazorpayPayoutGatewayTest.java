package com.flagship.payout_engine.processor;

import com.flagship.payout_engine.config.PayoutProperties;
import com.flagship.payout_engine.observability.PayoutMetrics;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the HTTP client against a local server to check request shape and
 * error translation.
 */
class RazorpayPayoutGatewayTest {

    private HttpServer server;
    private RazorpayPayoutGateway gateway;
    private SimpleMeterRegistry meterRegistry;

    private final AtomicReference<Integer> status = new AtomicReference<>(200);
    private final AtomicReference<String> responseBody = new AtomicReference<>("{}");
    private final AtomicReference<Long> delayMillis = new AtomicReference<>(0L);
    private final AtomicReference<String> lastPath = new AtomicReference<>();
    private final AtomicReference<String> lastRequestBody = new AtomicReference<>();
    private final AtomicReference<String> lastIdempotencyHeader = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();

        PayoutProperties properties = new PayoutProperties();
        properties.getProcessor().setBaseUrl("http://127.0.0.1:" + server.getAddress().getPort());
        properties.getProcessor().setKeyId("rzp_test_key");
        properties.getProcessor().setKeySecret("rzp_test_secret");
        properties.getProcessor().setAccountNumber("7878780080316316");
        properties.getProcessor().setReadTimeout(Duration.ofMillis(300));
        properties.getWebhook().setSecret("whsec");

        meterRegistry = new SimpleMeterRegistry();
        gateway = new RazorpayPayoutGateway(RestClient.builder(), CircuitBreakerRegistry.ofDefaults(),
                properties, new PayoutMetrics(meterRegistry));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        lastPath.set(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
        lastRequestBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        lastIdempotencyHeader.set(exchange.getRequestHeaders().getFirst("X-Payout-Idempotency"));
        lastAuthorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
        try {
            Thread.sleep(delayMillis.get());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        byte[] bytes = responseBody.get().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status.get(), bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private CreatePayoutCommand command() {
        return CreatePayoutCommand.builder()
                .fundAccountId("fa_1")
                .amount(50_000L)
                .currency("INR")
                .mode("IMPS")
                .purpose("payout")
                .referenceId("payout_user_42_n_abc")
                .notes(Map.of("transaction_id", "txn_1"))
                .build();
    }

    @Test
    @DisplayName("Create sends the reference id in body and header and parses the payout")
    void testCreatePayout() {
        responseBody.set("""
                {"id":"pout_1","entity":"payout","fund_account_id":"fa_1","amount":50000,"currency":"INR",
                 "fees":590,"tax":90,"status":"queued","purpose":"payout","utr":null,"mode":"IMPS",
                 "reference_id":"payout_user_42_n_abc","narration":null,"created_at":1772359200,
                 "status_details":{"source":"business","reason":"low_balance","description":"Low balance"}}
                """);

        ProcessorPayout payout = gateway.createPayout(command());

        assertEquals("pout_1", payout.getId());
        assertEquals("queued", payout.getStatus());
        assertEquals(590L, payout.getFees());
        assertEquals("low_balance", payout.getFailureReason());
        assertEquals("POST /payouts", lastPath.get());
        assertEquals("payout_user_42_n_abc", lastIdempotencyHeader.get());
        assertTrue(lastRequestBody.get().contains("\"reference_id\":\"payout_user_42_n_abc\""));
        assertTrue(lastRequestBody.get().contains("\"account_number\":\"7878780080316316\""));
        assertTrue(lastRequestBody.get().contains("\"queue_if_low_balance\":true"));
        assertTrue(lastAuthorization.get().startsWith("Basic "));
    }

    @Test
    @DisplayName("5xx and 429 are transient, other 4xx are permanent")
    void testErrorTranslation() {
        status.set(503);
        responseBody.set("{\"error\":{\"description\":\"down\"}}");
        PayoutGatewayException unavailable = assertThrows(PayoutGatewayException.class,
                () -> gateway.createPayout(command()));
        assertTrue(unavailable.isTransient());
        assertEquals(503, unavailable.getHttpStatus());

        status.set(429);
        assertTrue(assertThrows(PayoutGatewayException.class, () -> gateway.getPayout("pout_1")).isTransient());

        status.set(400);
        responseBody.set("{\"error\":{\"description\":\"The fund account id provided is invalid\"}}");
        PayoutGatewayException rejected = assertThrows(PayoutGatewayException.class,
                () -> gateway.createPayout(command()));
        assertFalse(rejected.isTransient());
        assertEquals(400, rejected.getHttpStatus());
    }

    @Test
    @DisplayName("A read timeout is a transient failure")
    void testTimeout() {
        delayMillis.set(1_500L);
        responseBody.set("{\"id\":\"pout_1\",\"status\":\"queued\"}");

        PayoutGatewayException e = assertThrows(PayoutGatewayException.class, () -> gateway.createPayout(command()));

        assertTrue(e.isTransient());
        assertTrue(e.isTimeout());
        assertEquals(1.0, meterRegistry.get("payout.processor.latency")
                .tag("operation", "create").tag("outcome", "timeout").timer().count());
    }

    @Test
    @DisplayName("Cancel and get hit the payout resource")
    void testGetAndCancel() {
        responseBody.set("{\"id\":\"pout_9\",\"status\":\"cancelled\"}");
        assertEquals("cancelled", gateway.cancelPayout("pout_9").getStatus());
        assertEquals("POST /payouts/pout_9/cancel", lastPath.get());

        responseBody.set("{\"id\":\"pout_9\",\"status\":\"processed\",\"utr\":\"UTR123\"}");
        assertEquals("UTR123", gateway.getPayout("pout_9").getUtr());
        assertEquals("GET /payouts/pout_9", lastPath.get());
    }

    @Test
    @DisplayName("Contacts and fund accounts are created with the processor's field names")
    void testContactAndFundAccounts() {
        responseBody.set("{\"id\":\"cont_1\",\"entity\":\"contact\",\"reference_id\":\"contact_user_42\",\"active\":true}");
        ProcessorContact contact = gateway.createContact(CreateContactCommand.builder()
                .name("Asha Rao")
                .email("asha@example.com")
                .phone("+919876543210")
                .type("customer")
                .referenceId("contact_user_42")
                .build());

        assertEquals("cont_1", contact.getId());
        assertTrue(contact.isActive());
        assertEquals("POST /contacts", lastPath.get());
        assertTrue(lastRequestBody.get().contains("\"contact\":\"+919876543210\""));

        responseBody.set("{\"id\":\"fa_7\",\"contact_id\":\"cont_1\",\"account_type\":\"bank_account\",\"active\":true}");
        ProcessorFundAccount bank = gateway.createFundAccount(CreateFundAccountCommand.builder()
                .contactId("cont_1")
                .accountType(CreateFundAccountCommand.BANK_ACCOUNT)
                .holderName("Asha Rao")
                .ifsc("HDFC0001234")
                .accountNumber("50100012345678")
                .build());

        assertEquals("fa_7", bank.getId());
        assertEquals("POST /fund_accounts", lastPath.get());
        assertTrue(lastRequestBody.get().contains("\"bank_account\":{"));
        assertTrue(lastRequestBody.get().contains("\"ifsc\":\"HDFC0001234\""));
        assertFalse(lastRequestBody.get().contains("\"vpa\""));

        responseBody.set("{\"id\":\"fa_7\",\"contact_id\":\"cont_1\",\"account_type\":\"bank_account\",\"active\":false}");
        ProcessorFundAccount deactivated = gateway.setFundAccountActive("fa_7", false);

        assertFalse(deactivated.isActive());
        assertEquals("PATCH /fund_accounts/fa_7", lastPath.get());
        assertTrue(lastRequestBody.get().contains("\"active\":false"));
    }

    @Test
    @DisplayName("Webhook signatures are checked with the configured secret")
    void testVerifySignature() {
        byte[] body = "{\"event\":\"payout.processed\"}".getBytes(StandardCharsets.UTF_8);
        String signature = new WebhookSignatureVerifier("whsec").sign(body);

        assertTrue(gateway.verifySignature(body, signature));
        assertFalse(gateway.verifySignature(body, new WebhookSignatureVerifier("other").sign(body)));
    }

    @Test
    @DisplayName("Only transient failures count against the circuit breaker")
    void testTransientFailurePredicate() {
        TransientFailurePredicate predicate = new TransientFailurePredicate();

        assertTrue(predicate.test(PayoutGatewayException.transientFailure("down", 503, null)));
        assertTrue(predicate.test(PayoutGatewayException.timeout("slow", null)));
        assertFalse(predicate.test(PayoutGatewayException.permanent("bad request", 400, null)));
        assertTrue(predicate.test(new IllegalStateException("unexpected")));
    }
}
