package com.flagship.payout_engine.payout;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payout_engine.outbox.OutboxEventRepository;
import com.flagship.payout_engine.processor.CreateContactCommand;
import com.flagship.payout_engine.processor.CreateFundAccountCommand;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.processor.ProcessorContact;
import com.flagship.payout_engine.processor.ProcessorFundAccount;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.transaction.TransactionRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of fund-account management with the processor mocked.
 *
 * These tests verify:
 * - Registration answers 201, a repeated registration 200 with the same reference
 * - A registered account can receive payouts
 * - Deactivation removes the account from the list and blocks payouts to it
 * - Processor and validation failures map onto 503, 422 and 400
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class FundAccountControllerTest {

    private static final String USER = "user_fa_1";

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
    private PayoutContactRepository contactRepository;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @MockBean
    private PayoutGateway payoutGateway;

    @BeforeEach
    void setUp() {
        outboxEventRepository.deleteAll();
        transactionRepository.deleteAll();
        fundAccountRepository.deleteAll();
        contactRepository.deleteAll();

        when(payoutGateway.createContact(any())).thenReturn(ProcessorContact.builder()
                .id("cont_http_1").referenceId("contact_" + USER).active(true).build());
        when(payoutGateway.createFundAccount(any())).thenReturn(ProcessorFundAccount.builder()
                .id("fa_http_1").contactId("cont_http_1").accountType("vpa").active(true).build());
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private static final String VPA_BODY = """
            {"holder_name":"Asha Rao","vpa":"asha.rao@okhdfc","phone":"09876543210"}
            """;

    private MvcResult registerVpa(int expectedStatus) throws Exception {
        return mockMvc.perform(post("/api/fund-accounts/vpas")
                        .header("X-User-Id", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VPA_BODY))
                .andExpect(status().is(expectedStatus))
                .andReturn();
    }

    private String reference(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString()).get("reference").asText();
    }

    @Test
    @DisplayName("Registering a VPA answers 201, repeating it 200 with the same reference")
    void testRegisterVpa() throws Exception {
        printTestHeader("Register VPA");

        String reference = reference(registerVpa(201));
        String again = reference(registerVpa(200));

        assertEquals(reference, again);
        assertEquals(1, fundAccountRepository.count());
        assertEquals("cont_http_1", contactRepository.findById(USER).orElseThrow().getProcessorContactId());

        ArgumentCaptor<CreateContactCommand> contact = ArgumentCaptor.forClass(CreateContactCommand.class);
        verify(payoutGateway, times(1)).createContact(contact.capture());
        assertEquals("+919876543210", contact.getValue().getPhone());
        verify(payoutGateway, times(1)).createFundAccount(any());

        printSuccess("VPA " + reference + " registered once");
    }

    @Test
    @DisplayName("A bank account is stored without its full number")
    void testRegisterBankAccount() throws Exception {
        printTestHeader("Register bank account");

        mockMvc.perform(post("/api/fund-accounts/bank-accounts")
                        .header("X-User-Id", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"holder_name":"Asha Rao","ifsc":"hdfc0001234","account_number":"123456789012"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.account_type").value("bank_account"))
                .andExpect(jsonPath("$.ifsc").value("HDFC0001234"))
                .andExpect(jsonPath("$.account_number_last4").value("9012"))
                .andExpect(jsonPath("$.account_number").doesNotExist());

        ArgumentCaptor<CreateFundAccountCommand> command = ArgumentCaptor.forClass(CreateFundAccountCommand.class);
        verify(payoutGateway).createFundAccount(command.capture());
        assertEquals(CreateFundAccountCommand.BANK_ACCOUNT, command.getValue().getAccountType());
        assertEquals("123456789012", command.getValue().getAccountNumber());

        printSuccess("Bank account registered");
    }

    @Test
    @DisplayName("A registered fund account receives payouts until it is deactivated")
    void testLifecycle() throws Exception {
        printTestHeader("Register, pay, deactivate");
        String reference = reference(registerVpa(201));
        when(payoutGateway.createPayout(any())).thenReturn(ProcessorPayout.builder()
                .id("pout_fa_1").status("queued").build());
        when(payoutGateway.setFundAccountActive(eq("fa_http_1"), eq(false))).thenReturn(ProcessorFundAccount.builder()
                .id("fa_http_1").active(false).build());
        String payoutBody = """
                {"user_id":"%s","fund_account_ref":"%s","amount":25000,"mode":"UPI","purpose":"payout"}
                """.formatted(USER, reference);

        mockMvc.perform(get("/api/fund-accounts").header("X-User-Id", USER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].reference").value(reference))
                .andExpect(jsonPath("$[0].vpa").value("asha.rao@okhdfc"));

        mockMvc.perform(post("/api/payouts").contentType(MediaType.APPLICATION_JSON).content(payoutBody))
                .andExpect(status().isCreated());

        mockMvc.perform(post("/api/fund-accounts/{ref}/deactivate", reference).header("X-User-Id", USER))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/fund-accounts").header("X-User-Id", USER))
                .andExpect(jsonPath("$.length()").value(0));
        mockMvc.perform(post("/api/payouts").contentType(MediaType.APPLICATION_JSON).content(payoutBody))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_code").value("FUND_ACCOUNT_INACTIVE"));
        verify(payoutGateway, times(1)).createPayout(any());

        printSuccess("Deactivated account no longer receives payouts");
    }

    @Test
    @DisplayName("Deactivating someone else's fund account answers 404")
    void testDeactivate_OtherUser() throws Exception {
        printTestHeader("Deactivate foreign account");
        String reference = reference(registerVpa(201));

        mockMvc.perform(post("/api/fund-accounts/{ref}/deactivate", reference).header("X-User-Id", "user_other"))
                .andExpect(status().isNotFound());

        verify(payoutGateway, never()).setFundAccountActive(any(), eq(false));
        assertTrue(fundAccountRepository.findById(reference).orElseThrow().isActive());

        printSuccess("Foreign account untouched");
    }

    @Test
    @DisplayName("Processor outages answer 503, rejections 422, bad input 400")
    void testFailures() throws Exception {
        printTestHeader("Failure mapping");

        when(payoutGateway.createFundAccount(any()))
                .thenThrow(PayoutGatewayException.transientFailure("HTTP 503", 503, null))
                .thenThrow(PayoutGatewayException.permanent("HTTP 400: invalid vpa", 400, null));
        registerVpa(503);
        registerVpa(422);
        assertEquals(0, fundAccountRepository.count());

        mockMvc.perform(post("/api/fund-accounts/bank-accounts")
                        .header("X-User-Id", USER)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"holder_name":"Asha Rao","ifsc":"HDFC1001234","account_number":"123456789012"}
                                """))
                .andExpect(status().isBadRequest());
        mockMvc.perform(post("/api/fund-accounts/vpas")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(VPA_BODY))
                .andExpect(status().isBadRequest());

        printSuccess("Failures mapped");
    }
}
