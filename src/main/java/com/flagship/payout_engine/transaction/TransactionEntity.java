package com.flagship.payout_engine.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * JPA entity for payout transactions.
 *
 * - No setters: the only writes are {@link #fromDomain} and {@link #updateFromDomain}
 * - Identity, money and classification columns are updatable = false
 * - @Version backs the optimistic check in applyTransition
 * - History and metadata are jsonb, serialized by {@link TransactionJsonCodec}
 */
@Entity
@Table(
    name = "payout_transactions",
    indexes = {
        @Index(name = "idx_payout_tx_user", columnList = "user_id"),
        @Index(name = "idx_payout_tx_state_next_retry", columnList = "state, next_retry_at"),
        @Index(name = "idx_payout_tx_created_at", columnList = "created_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class TransactionEntity {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false, length = 64)
    private String transactionId;

    @Column(name = "idempotency_key", nullable = false, updatable = false, unique = true, length = 128)
    private String idempotencyKey;

    @Column(name = "external_payout_id", unique = true, length = 64)
    private String externalPayoutId;

    @Column(name = "user_id", nullable = false, updatable = false, length = 64)
    private String userId;

    @Column(name = "fund_account_ref", nullable = false, updatable = false, length = 64)
    private String fundAccountRef;

    @Column(name = "processor_fund_account_id", updatable = false, length = 64)
    private String processorFundAccountId;

    @Column(name = "processor_contact_id", updatable = false, length = 64)
    private String processorContactId;

    @Column(name = "beneficiary_name", updatable = false)
    private String beneficiaryName;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 20)
    private TransactionType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "mode", nullable = false, updatable = false, length = 10)
    private PayoutMode mode;

    @Enumerated(EnumType.STRING)
    @Column(name = "purpose", nullable = false, updatable = false, length = 20)
    private PayoutPurpose purpose;

    @Column(name = "amount", nullable = false, updatable = false)
    private long amount;

    @Column(name = "currency", nullable = false, updatable = false, length = 3)
    private String currency;

    @Column(name = "fees")
    private Long fees;

    @Column(name = "tax")
    private Long tax;

    @Column(name = "utr", length = 64)
    private String utr;

    @Column(name = "narration", updatable = false)
    private String narration;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private TransactionState state;

    @Enumerated(EnumType.STRING)
    @Column(name = "previous_state", length = 20)
    private TransactionState previousState;

    @Column(name = "state_history", nullable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String stateHistory;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "max_retries", nullable = false, updatable = false)
    private int maxRetries;

    @Column(name = "next_retry_at")
    private Instant nextRetryAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "failure_reason", length = 40)
    private FailureReason failureReason;

    @Column(name = "failure_description", columnDefinition = "TEXT")
    private String failureDescription;

    @Column(name = "metadata", nullable = false, updatable = false, columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String metadata;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "failed_at")
    private Instant failedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    static TransactionEntity fromDomain(PayoutTransaction tx, String historyJson, String metadataJson) {
        TransactionEntity entity = new TransactionEntity();
        entity.transactionId = tx.getTransactionId();
        entity.idempotencyKey = tx.getIdempotencyKey();
        entity.userId = tx.getUserId();
        entity.fundAccountRef = tx.getFundAccountRef();
        entity.processorFundAccountId = tx.getProcessorFundAccountId();
        entity.processorContactId = tx.getProcessorContactId();
        entity.beneficiaryName = tx.getBeneficiaryName();
        entity.type = tx.getType();
        entity.mode = tx.getMode();
        entity.purpose = tx.getPurpose();
        entity.amount = tx.getAmount();
        entity.currency = tx.getCurrency();
        entity.narration = tx.getNarration();
        entity.maxRetries = tx.getMaxRetries();
        entity.metadata = metadataJson;
        entity.createdAt = tx.getCreatedAt();
        entity.updateFromDomain(tx, historyJson);
        return entity;
    }

    /**
     * Copies the mutable columns. Everything written here is what a
     * transition may change.
     */
    void updateFromDomain(PayoutTransaction tx, String historyJson) {
        this.externalPayoutId = tx.getExternalPayoutId();
        this.fees = tx.getFees();
        this.tax = tx.getTax();
        this.utr = tx.getUtr();
        this.state = tx.getState();
        this.previousState = tx.getPreviousState();
        this.stateHistory = historyJson;
        this.retryCount = tx.getRetryCount();
        this.nextRetryAt = tx.getNextRetryAt();
        this.failureReason = tx.getFailureReason();
        this.failureDescription = tx.getFailureDescription();
        this.updatedAt = tx.getUpdatedAt();
        this.submittedAt = tx.getSubmittedAt();
        this.completedAt = tx.getCompletedAt();
        this.failedAt = tx.getFailedAt();
    }

    PayoutTransaction toDomain(List<StateTransition> history, Map<String, String> metadataMap) {
        return PayoutTransaction.builder()
                .transactionId(transactionId)
                .idempotencyKey(idempotencyKey)
                .externalPayoutId(externalPayoutId)
                .userId(userId)
                .fundAccountRef(fundAccountRef)
                .processorFundAccountId(processorFundAccountId)
                .processorContactId(processorContactId)
                .beneficiaryName(beneficiaryName)
                .type(type)
                .mode(mode)
                .purpose(purpose)
                .amount(amount)
                .currency(currency)
                .fees(fees)
                .tax(tax)
                .utr(utr)
                .narration(narration)
                .state(state)
                .previousState(previousState)
                .stateHistory(history)
                .retryCount(retryCount)
                .maxRetries(maxRetries)
                .nextRetryAt(nextRetryAt)
                .failureReason(failureReason)
                .failureDescription(failureDescription)
                .metadata(metadataMap)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .submittedAt(submittedAt)
                .completedAt(completedAt)
                .failedAt(failedAt)
                .version(version)
                .build();
    }
}
