package com.flagship.payout_engine.processor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_engine.config.PayoutProperties;
import com.flagship.payout_engine.observability.PayoutMetrics;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * HTTP client for the RazorpayX payouts API.
 *
 * - Basic auth with key id and secret
 * - Bounded connect and read timeouts; a timeout is a transient failure
 * - Every call runs inside the "payoutProcessor" circuit breaker
 * - reference_id and X-Payout-Idempotency carry the idempotency key
 * - Contacts and fund accounts go through the same breaker and error mapping
 */
@Component
@Slf4j
public class RazorpayPayoutGateway implements PayoutGateway {

    static final String CIRCUIT_BREAKER_NAME = "payoutProcessor";
    private static final String IDEMPOTENCY_HEADER = "X-Payout-Idempotency";

    private final RestClient restClient;
    private final CircuitBreaker circuitBreaker;
    private final PayoutProperties.Processor config;
    private final WebhookSignatureVerifier signatureVerifier;
    private final PayoutMetrics payoutMetrics;

    public RazorpayPayoutGateway(RestClient.Builder builder,
                                 CircuitBreakerRegistry circuitBreakerRegistry,
                                 PayoutProperties properties,
                                 PayoutMetrics payoutMetrics) {
        this.config = properties.getProcessor();
        this.payoutMetrics = payoutMetrics;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);

        // JDK client: fund-account updates need PATCH
        HttpClient httpClient = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(config.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(config.getReadTimeout());

        this.restClient = builder
                .baseUrl(config.getBaseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("Authorization", basicAuth(config.getKeyId(), config.getKeySecret()))
                .build();

        String secret = properties.getWebhook().getSecret();
        this.signatureVerifier = secret == null || secret.isBlank() ? null : new WebhookSignatureVerifier(secret);
        if (signatureVerifier == null) {
            log.warn("payout.webhook.secret is not set; every webhook will be rejected");
        }
    }

    @Override
    public ProcessorPayout createPayout(CreatePayoutCommand command) {
        CreatePayoutBody body = new CreatePayoutBody(
                config.getAccountNumber(),
                command.getFundAccountId(),
                command.getAmount(),
                command.getCurrency(),
                command.getMode(),
                command.getPurpose(),
                config.isQueueIfLowBalance(),
                command.getReferenceId(),
                command.getNarration(),
                command.getNotes());

        return call("create", () -> restClient.post()
                .uri("/payouts")
                .header(IDEMPOTENCY_HEADER, command.getReferenceId())
                .body(body)
                .retrieve()
                .body(PayoutEntity.class));
    }

    @Override
    public ProcessorPayout getPayout(String externalPayoutId) {
        return call("get", () -> restClient.get()
                .uri("/payouts/{id}", externalPayoutId)
                .retrieve()
                .body(PayoutEntity.class));
    }

    @Override
    public ProcessorPayout cancelPayout(String externalPayoutId) {
        return call("cancel", () -> restClient.post()
                .uri("/payouts/{id}/cancel", externalPayoutId)
                .retrieve()
                .body(PayoutEntity.class));
    }

    @Override
    public ProcessorContact createContact(CreateContactCommand command) {
        CreateContactBody body = new CreateContactBody(
                command.getName(),
                command.getEmail(),
                command.getPhone(),
                command.getType(),
                command.getReferenceId(),
                command.getNotes());

        ContactEntity contact = execute("create_contact", ContactEntity::id, () -> restClient.post()
                .uri("/contacts")
                .body(body)
                .retrieve()
                .body(ContactEntity.class));
        return contact.toProcessorContact();
    }

    @Override
    public ProcessorFundAccount createFundAccount(CreateFundAccountCommand command) {
        boolean vpa = CreateFundAccountCommand.VPA.equals(command.getAccountType());
        CreateFundAccountBody body = new CreateFundAccountBody(
                command.getContactId(),
                command.getAccountType(),
                vpa ? null : new BankAccountBody(command.getHolderName(), command.getIfsc(), command.getAccountNumber()),
                vpa ? new VpaBody(command.getVpaAddress()) : null);

        FundAccountEntity account = execute("create_fund_account", FundAccountEntity::id, () -> restClient.post()
                .uri("/fund_accounts")
                .body(body)
                .retrieve()
                .body(FundAccountEntity.class));
        return account.toProcessorFundAccount();
    }

    @Override
    public ProcessorFundAccount setFundAccountActive(String fundAccountId, boolean active) {
        FundAccountEntity account = execute("update_fund_account", FundAccountEntity::id, () -> restClient.patch()
                .uri("/fund_accounts/{id}", fundAccountId)
                .body(Map.of("active", active))
                .retrieve()
                .body(FundAccountEntity.class));
        return account.toProcessorFundAccount();
    }

    @Override
    public boolean verifySignature(byte[] rawBody, String signature) {
        return signatureVerifier != null && signatureVerifier.verify(rawBody, signature);
    }

    private ProcessorPayout call(String operation, Supplier<PayoutEntity> request) {
        return execute(operation, PayoutEntity::id, request).toProcessorPayout();
    }

    private <T> T execute(String operation, Function<T, String> idOf, Supplier<T> request) {
        long start = System.nanoTime();
        String outcome = "success";
        try {
            T entity = circuitBreaker.executeSupplier(() -> translateErrors(operation, request));
            if (entity == null || idOf.apply(entity) == null) {
                outcome = "empty";
                throw PayoutGatewayException.transientFailure(
                        "Processor returned an empty response for " + operation, null, null);
            }
            return entity;
        } catch (CallNotPermittedException e) {
            outcome = "circuit_open";
            throw PayoutGatewayException.transientFailure("Payout processor circuit is open", null, e);
        } catch (PayoutGatewayException e) {
            outcome = e.isTimeout() ? "timeout" : e.getKind().name().toLowerCase();
            throw e;
        } finally {
            payoutMetrics.recordProcessorCall(operation, outcome, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private <T> T translateErrors(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException e) {
            HttpStatusCode status = e.getStatusCode();
            String message = "Processor " + operation + " failed with HTTP " + status.value() + ": "
                    + e.getResponseBodyAsString();
            if (status.is5xxServerError() || status.value() == 429) {
                throw PayoutGatewayException.transientFailure(message, status.value(), e);
            }
            throw PayoutGatewayException.permanent(message, status.value(), e);
        } catch (ResourceAccessException e) {
            if (isTimeout(e)) {
                throw PayoutGatewayException.timeout("Processor " + operation + " timed out", e);
            }
            throw PayoutGatewayException.transientFailure(
                    "Processor " + operation + " unreachable: " + e.getMessage(), null, e);
        } catch (RestClientException e) {
            throw PayoutGatewayException.transientFailure(
                    "Processor " + operation + " failed: " + e.getMessage(), null, e);
        }
    }

    private static boolean isTimeout(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
                return true;
            }
        }
        return false;
    }

    private static String basicAuth(String keyId, String keySecret) {
        String credentials = (keyId == null ? "" : keyId) + ":" + (keySecret == null ? "" : keySecret);
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreatePayoutBody(
            @JsonProperty("account_number") String accountNumber,
            @JsonProperty("fund_account_id") String fundAccountId,
            @JsonProperty("amount") long amount,
            @JsonProperty("currency") String currency,
            @JsonProperty("mode") String mode,
            @JsonProperty("purpose") String purpose,
            @JsonProperty("queue_if_low_balance") boolean queueIfLowBalance,
            @JsonProperty("reference_id") String referenceId,
            @JsonProperty("narration") String narration,
            @JsonProperty("notes") Map<String, String> notes) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateContactBody(
            @JsonProperty("name") String name,
            @JsonProperty("email") String email,
            @JsonProperty("contact") String contact,
            @JsonProperty("type") String type,
            @JsonProperty("reference_id") String referenceId,
            @JsonProperty("notes") Map<String, String> notes) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record CreateFundAccountBody(
            @JsonProperty("contact_id") String contactId,
            @JsonProperty("account_type") String accountType,
            @JsonProperty("bank_account") BankAccountBody bankAccount,
            @JsonProperty("vpa") VpaBody vpa) {}

    record BankAccountBody(
            @JsonProperty("name") String name,
            @JsonProperty("ifsc") String ifsc,
            @JsonProperty("account_number") String accountNumber) {}

    record VpaBody(@JsonProperty("address") String address) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ContactEntity(
            @JsonProperty("id") String id,
            @JsonProperty("reference_id") String referenceId,
            @JsonProperty("active") Boolean active) {

        ProcessorContact toProcessorContact() {
            return ProcessorContact.builder()
                    .id(id)
                    .referenceId(referenceId)
                    .active(active == null || active)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record FundAccountEntity(
            @JsonProperty("id") String id,
            @JsonProperty("contact_id") String contactId,
            @JsonProperty("account_type") String accountType,
            @JsonProperty("active") Boolean active) {

        ProcessorFundAccount toProcessorFundAccount() {
            return ProcessorFundAccount.builder()
                    .id(id)
                    .contactId(contactId)
                    .accountType(accountType)
                    .active(active == null || active)
                    .build();
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record StatusDetails(
            @JsonProperty("source") String source,
            @JsonProperty("reason") String reason,
            @JsonProperty("description") String description) {}

    /**
     * Payout entity as returned by the API and embedded in webhooks.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PayoutEntity(
            @JsonProperty("id") String id,
            @JsonProperty("fund_account_id") String fundAccountId,
            @JsonProperty("amount") Long amount,
            @JsonProperty("currency") String currency,
            @JsonProperty("fees") Long fees,
            @JsonProperty("tax") Long tax,
            @JsonProperty("status") String status,
            @JsonProperty("purpose") String purpose,
            @JsonProperty("utr") String utr,
            @JsonProperty("mode") String mode,
            @JsonProperty("reference_id") String referenceId,
            @JsonProperty("narration") String narration,
            @JsonProperty("failure_reason") String failureReason,
            @JsonProperty("status_details") StatusDetails statusDetails,
            @JsonProperty("created_at") Long createdAt) {

        public ProcessorPayout toProcessorPayout() {
            String reason = statusDetails != null && statusDetails.reason() != null
                    ? statusDetails.reason()
                    : failureReason;
            String description = statusDetails != null && statusDetails.description() != null
                    ? statusDetails.description()
                    : failureReason;
            return ProcessorPayout.builder()
                    .id(id)
                    .status(status)
                    .utr(utr)
                    .amount(amount)
                    .fees(fees)
                    .tax(tax)
                    .mode(mode)
                    .referenceId(referenceId)
                    .failureReason(reason)
                    .failureDescription(description)
                    .createdAt(createdAt)
                    .build();
        }
    }
}
