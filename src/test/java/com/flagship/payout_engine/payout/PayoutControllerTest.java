package com.flagship.payout_engine.payout;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payout_engine.outbox.OutboxEventRepository;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.support.TestPayouts;
import com.flagship.payout_engine.transaction.TransactionRepository;
import com.flagship.payout_engine.webhook.WebhookEventRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of the payout API with the processor mocked.
 *
 * These tests verify:
 * - Creation answers 201, a replayed Idempotency-Key 200 with the same payout
 * - Validation failures answer 400 and store nothing
 * - A processor outage answers 202 and leaves the payout to the retry worker
 * - Cancellation and lookup map their outcomes onto HTTP statuses
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class PayoutControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("payout_engine_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("payout.retry.scheduler-enabled", () -> "false");
        registry.add("payout.reconciliation.scheduler-enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private FundAccountRepository fundAccountRepository;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private WebhookEventRepository webhookEventRepository;

    @MockBean
    private PayoutGateway payoutGateway;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        webhookEventRepository.deleteAll();
        transactionRepository.deleteAll();
        fundAccountRepository.deleteAll();
        fundAccountRepository.save(FundAccountEntity.create(TestPayouts.fundAccount(), null, Instant.now()));
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static String createBody(long amount) {
        return """
                {"user_id":"%s","fund_account_ref":"%s","amount":%d,"mode":"UPI","purpose":"payout",
                 "narration":"Wallet cashout","metadata":{"order_id":"ord_1"}}
                """.formatted(TestPayouts.USER_ID, TestPayouts.FUND_ACCOUNT_REF, amount);
    }

    private void processorAnswers(String payoutId, String status) {
        when(payoutGateway.createPayout(any())).thenReturn(ProcessorPayout.builder()
                .id(payoutId)
                .status(status)
                .fees(590L)
                .tax(90L)
                .build());
    }

    private JsonNode json(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    @Test
    @DisplayName("Create answers 201 and the payout can be read back with its history")
    void testCreatePayout_Created() throws Exception {
        printTestHeader("Create payout");
        processorAnswers("pout_http_1", "queued");

        MvcResult created = mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.state").value("queued"))
                .andExpect(jsonPath("$.external_payout_id").value("pout_http_1"))
                .andReturn();
        String transactionId = json(created).get("transaction_id").asText();

        mockMvc.perform(get("/api/payouts/{id}", transactionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.amount").value(50000))
                .andExpect(jsonPath("$.mode").value("UPI"))
                .andExpect(jsonPath("$.metadata.order_id").value("ord_1"))
                .andExpect(jsonPath("$.state_history.length()").value(2))
                .andExpect(jsonPath("$.state_history[1].to").value("queued"));

        printSuccess("Payout " + transactionId + " queued");
    }

    @Test
    @DisplayName("Replaying an Idempotency-Key returns the same payout with 200")
    void testCreatePayout_IdempotentReplay() throws Exception {
        printTestHeader("Idempotent replay");
        processorAnswers("pout_http_2", "queued");
        String key = "order-" + UUID.randomUUID();

        MvcResult first = mockMvc.perform(post("/api/payouts")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isCreated())
                .andReturn();
        MvcResult second = mockMvc.perform(post("/api/payouts")
                        .header("Idempotency-Key", key)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true))
                .andReturn();

        assertEquals(json(first).get("transaction_id").asText(), json(second).get("transaction_id").asText());
        assertEquals(1, transactionRepository.count());
        verify(payoutGateway, times(1)).createPayout(any());

        printSuccess("Second request mapped onto the first payout");
    }

    @Test
    @DisplayName("Invalid requests answer 400 and nothing is stored")
    void testCreatePayout_Validation() throws Exception {
        printTestHeader("Request validation");

        mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50L)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_AMOUNT"));

        mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fund_account_ref\":\"fa_ref_1\",\"amount\":5000,\"mode\":\"UPI\",\"purpose\":\"payout\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.userId").exists());

        mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L).replace("\"UPI\"", "\"SWIFT\"")))
                .andExpect(status().isBadRequest());

        assertEquals(0, transactionRepository.count());
        printSuccess("All invalid requests rejected");
    }

    @Test
    @DisplayName("Processor outage answers 202 and the payout waits in submitted")
    void testCreatePayout_ProcessorUnavailable() throws Exception {
        printTestHeader("Processor outage");
        when(payoutGateway.createPayout(any()))
                .thenThrow(PayoutGatewayException.transientFailure("Processor create failed with HTTP 503", 503, null));

        mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.state").value("submitted"))
                .andExpect(jsonPath("$.error_code").value("PROCESSOR_UNAVAILABLE"));

        printSuccess("Payout parked for retry");
    }

    @Test
    @DisplayName("Unknown payouts answer 404")
    void testGetPayout_NotFound() throws Exception {
        mockMvc.perform(get("/api/payouts/{id}", "txn_missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Not Found"));
    }

    @Test
    @DisplayName("Owner can cancel a queued payout, the header is required")
    void testCancelPayout() throws Exception {
        printTestHeader("Cancel payout");
        processorAnswers("pout_http_3", "queued");
        when(payoutGateway.cancelPayout("pout_http_3")).thenReturn(ProcessorPayout.builder()
                .id("pout_http_3")
                .status("cancelled")
                .build());

        MvcResult created = mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isCreated())
                .andReturn();
        String transactionId = json(created).get("transaction_id").asText();

        mockMvc.perform(post("/api/payouts/{id}/cancel", transactionId))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/payouts/{id}/cancel", transactionId).header("X-User-Id", "user_99"))
                .andExpect(status().isNotFound());
        mockMvc.perform(post("/api/payouts/{id}/cancel", transactionId).header("X-User-Id", TestPayouts.USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("cancelled"));
        mockMvc.perform(post("/api/payouts/{id}/cancel", transactionId).header("X-User-Id", TestPayouts.USER_ID))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("NOT_CANCELLABLE"));

        printSuccess("Queued payout cancelled once");
    }

    @Test
    @DisplayName("Listing and stats are scoped to the user")
    void testListAndStats() throws Exception {
        processorAnswers("pout_http_4", "queued");
        mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/api/payouts")
                        .param("user_id", TestPayouts.USER_ID)
                        .param("state", "queued"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.items[0].state").value("queued"));

        mockMvc.perform(get("/api/payouts").param("sort", "colour"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/payouts/stats").param("user_id", TestPayouts.USER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.pending").value(1))
                .andExpect(jsonPath("$.total_amount").value(50000));
    }

    @Test
    @DisplayName("Webhook endpoint rejects bad signatures and applies signed events")
    void testWebhookEndpoint() throws Exception {
        printTestHeader("Webhook endpoint");
        processorAnswers("pout_http_5", "queued");
        mockMvc.perform(post("/api/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(createBody(50_000L)))
                .andExpect(status().isCreated());

        String body = """
                {"entity":"event","account_id":"acc_test","event":"payout.processing","contains":["payout"],
                 "payload":{"payout":{"entity":{"id":"pout_http_5","status":"processing"}}},"created_at":1772359300}
                """;
        when(payoutGateway.verifySignature(any(byte[].class), eq("good"))).thenReturn(true);

        mockMvc.perform(post("/api/webhooks/payouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/webhooks/payouts")
                        .header("X-Razorpay-Signature", "bad")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isUnauthorized());
        mockMvc.perform(post("/api/webhooks/payouts")
                        .header("X-Razorpay-Signature", "good")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("APPLIED"));
        mockMvc.perform(post("/api/webhooks/payouts")
                        .header("X-Razorpay-Signature", "good")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));

        MvcResult listed = mockMvc.perform(get("/api/payouts").param("user_id", TestPayouts.USER_ID))
                .andExpect(jsonPath("$.items[0].state").value("processing"))
                .andReturn();
        String transactionId = json(listed).get("items").get(0).get("transaction_id").asText();

        mockMvc.perform(get("/api/operations/payouts/" + transactionId + "/webhooks"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].eventType").value("payout.processing"))
                .andExpect(jsonPath("$[0].outcome").value("APPLIED"));
        MvcResult events = mockMvc.perform(get("/api/operations/payouts/" + transactionId + "/events"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].aggregateId").value(transactionId))
                .andExpect(jsonPath("$[0].eventType").value("PayoutStateChanged"))
                .andReturn();
        assertTrue(json(events).size() >= 2, "create and webhook transitions both recorded");
        mockMvc.perform(get("/api/operations/payouts/txn_missing/events"))
                .andExpect(status().isNotFound());

        printSuccess("Signed webhook applied once and visible in the audit views");
    }
}
