package com.flagship.payout_engine.payout;

import com.flagship.payout_engine.config.PayoutProperties;
import com.flagship.payout_engine.idempotency.IdempotencyKeyGenerator;
import com.flagship.payout_engine.idempotency.IdempotencyService;
import com.flagship.payout_engine.observability.CorrelationContext;
import com.flagship.payout_engine.observability.PayoutMetrics;
import com.flagship.payout_engine.payout.PayoutSubmissionResult.ErrorCode;
import com.flagship.payout_engine.processor.CreatePayoutCommand;
import com.flagship.payout_engine.processor.PayoutGateway;
import com.flagship.payout_engine.processor.PayoutGatewayException;
import com.flagship.payout_engine.processor.ProcessorPayout;
import com.flagship.payout_engine.processor.ProcessorStatusMapper;
import com.flagship.payout_engine.transaction.FailureReason;
import com.flagship.payout_engine.transaction.PayoutTransaction;
import com.flagship.payout_engine.transaction.StateTransition;
import com.flagship.payout_engine.transaction.StoreResult;
import com.flagship.payout_engine.transaction.TransactionFieldUpdates;
import com.flagship.payout_engine.transaction.TransactionState;
import com.flagship.payout_engine.transaction.TransactionStateMachine;
import com.flagship.payout_engine.transaction.TransactionStore;
import com.flagship.payout_engine.transaction.TransitionSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Creates payout transactions and submits them to the processor.
 *
 * Flow:
 * 1. Validate amount against the rail limits and resolve the fund account
 * 2. Derive the idempotency key; a known nonce returns the existing payout
 * 3. Store the transaction in INITIATED
 * 4. Call the processor with the key as reference_id (no database lock is held)
 * 5. Record the processor's answer, or park the payout in SUBMITTED for retry
 *
 * Validation failures are never persisted. Processor outages are never
 * raised to the caller; the result carries success=false and the
 * transaction id to poll.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PayoutSubmitter {

    private final TransactionStore transactionStore;
    private final FundAccountDirectory fundAccountDirectory;
    private final PayoutGateway payoutGateway;
    private final IdempotencyKeyGenerator keyGenerator;
    private final IdempotencyService idempotencyService;
    private final PayoutProperties properties;
    private final PayoutMetrics payoutMetrics;
    private final Clock clock;

    public PayoutSubmissionResult initiate(PayoutRequest request) {
        String mode = request.getMode() != null ? request.getMode().getValue() : null;

        Optional<FundAccount> fundAccount = request.getFundAccountRef() == null
                ? Optional.empty()
                : fundAccountDirectory.findByReference(request.getFundAccountRef());
        Optional<PayoutSubmissionResult> invalid = validate(request, fundAccount);
        if (invalid.isPresent()) {
            payoutMetrics.recordSubmission(mode, "rejected");
            log.warn("Payout rejected: userId={}, errorCode={}, error={}",
                    request.getUserId(), invalid.get().getErrorCode(), invalid.get().getError());
            return invalid.get();
        }

        String idempotencyKey = keyGenerator.submissionKey(request.getUserId(), request.getClientNonce());
        if (request.getClientNonce() != null && !request.getClientNonce().isBlank()) {
            Optional<PayoutSubmissionResult> replay = findReplay(idempotencyKey);
            if (replay.isPresent()) {
                return replay.get();
            }
            payoutMetrics.recordIdempotencyMiss();
        }

        Instant now = clock.instant();
        PayoutTransaction draft = PayoutTransaction.builder()
                .transactionId(keyGenerator.transactionId())
                .idempotencyKey(idempotencyKey)
                .userId(request.getUserId())
                .fundAccountRef(fundAccount.get().getReference())
                .processorFundAccountId(fundAccount.get().getProcessorFundAccountId())
                .processorContactId(fundAccount.get().getProcessorContactId())
                .beneficiaryName(fundAccount.get().getBeneficiaryName())
                .type(request.getType())
                .mode(request.getMode())
                .purpose(request.getPurpose())
                .amount(request.getAmount())
                .currency(PayoutTransaction.CURRENCY_INR)
                .narration(request.getNarration())
                .metadata(request.getMetadata())
                .maxRetries(properties.getRetry().getMaxRetries())
                .build();

        StoreResult<PayoutTransaction> created = transactionStore.create(PayoutTransaction.initiate(draft, now));
        if (created.getKind() == StoreResult.Kind.ALREADY_EXISTS) {
            return findReplay(idempotencyKey).orElseGet(() ->
                    PayoutSubmissionResult.rejected(ErrorCode.CONFLICT, created.getMessage()));
        }
        PayoutTransaction tx = created.orElseThrow();
        idempotencyService.remember(idempotencyKey, tx.getTransactionId());

        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, tx.getTransactionId());
        try {
            log.info("Payout initiated: amount={}, mode={}, purpose={}",
                    tx.getAmount(), mode, tx.getPurpose().getValue());
            PayoutSubmissionResult result = submit(tx);
            payoutMetrics.recordSubmission(mode, result.isSuccess() ? "accepted" : result.getErrorCode().name());
            return result;
        } finally {
            MDC.remove(CorrelationContext.TRANSACTION_ID_MDC_KEY);
        }
    }

    private Optional<PayoutSubmissionResult> validate(PayoutRequest request, Optional<FundAccount> fundAccount) {
        if (request.getMode() == null || request.getPurpose() == null || request.getUserId() == null) {
            return Optional.of(PayoutSubmissionResult.rejected(
                    ErrorCode.INVALID_REQUEST, "userId, mode and purpose are required"));
        }
        if (!request.getMode().accepts(request.getAmount())) {
            return Optional.of(PayoutSubmissionResult.rejected(
                    ErrorCode.INVALID_AMOUNT, "Invalid amount for mode: " + request.getMode().describeLimits()));
        }
        if (fundAccount.isEmpty()) {
            return Optional.of(PayoutSubmissionResult.rejected(
                    ErrorCode.FUND_ACCOUNT_NOT_FOUND, "Fund account not found: " + request.getFundAccountRef()));
        }
        if (!fundAccount.get().isOwnedBy(request.getUserId())) {
            return Optional.of(PayoutSubmissionResult.rejected(
                    ErrorCode.FUND_ACCOUNT_NOT_OWNED, "Fund account does not belong to user"));
        }
        if (!fundAccount.get().isActive()) {
            return Optional.of(PayoutSubmissionResult.rejected(
                    ErrorCode.FUND_ACCOUNT_INACTIVE, "Fund account is not active"));
        }
        return Optional.empty();
    }

    private Optional<PayoutSubmissionResult> findReplay(String idempotencyKey) {
        return idempotencyService.findTransactionId(idempotencyKey)
                .flatMap(transactionStore::getByTransactionId)
                .map(existing -> {
                    payoutMetrics.recordIdempotencyHit();
                    log.info("Idempotency key already used, returning existing payout: transactionId={}",
                            existing.getTransactionId());
                    return PayoutSubmissionResult.builder()
                            .success(!existing.getState().isFailedTerminal())
                            .transactionId(existing.getTransactionId())
                            .externalPayoutId(existing.getExternalPayoutId())
                            .state(existing.getState())
                            .duplicate(true)
                            .build();
                });
    }

    private PayoutSubmissionResult submit(PayoutTransaction tx) {
        ProcessorPayout payout;
        try {
            payout = payoutGateway.createPayout(CreatePayoutCommand.forTransaction(tx));
        } catch (PayoutGatewayException e) {
            return e.isTransient() ? deferForRetry(tx, e) : rejectPermanently(tx, e);
        }
        return recordAcceptance(tx, payout);
    }

    private PayoutSubmissionResult recordAcceptance(PayoutTransaction tx, ProcessorPayout payout) {
        Instant now = clock.instant();
        Optional<TransactionState> mapped = ProcessorStatusMapper.toState(payout.getStatus());

        StateTransition transition;
        TransactionFieldUpdates updates;
        if (mapped.isPresent() && TransactionStateMachine.isValidTransition(TransactionState.INITIATED, mapped.get())) {
            transition = StateTransition.builder()
                    .from(TransactionState.INITIATED)
                    .to(mapped.get())
                    .timestamp(now)
                    .source(TransitionSource.SYSTEM)
                    .reason("Processor accepted payout with status " + payout.getStatus())
                    .metadata(Map.of("external_payout_id", payout.getId()))
                    .build();
            updates = payout.toFieldUpdates(mapped.get()).submittedAt(now).build();
        } else {
            // Accepted but not reachable from INITIATED: park in SUBMITTED without a retry
            // date so only the reconciler touches it from here.
            log.warn("Processor status not reachable from initiated: externalPayoutId={}, status={}",
                    payout.getId(), payout.getStatus());
            transition = StateTransition.builder()
                    .from(TransactionState.INITIATED)
                    .to(TransactionState.SUBMITTED)
                    .timestamp(now)
                    .source(TransitionSource.SYSTEM)
                    .reason("Processor returned status " + payout.getStatus() + "; awaiting reconciliation")
                    .metadata(Map.of("external_payout_id", payout.getId(),
                            "processor_status", String.valueOf(payout.getStatus())))
                    .build();
            updates = payout.toFieldUpdates(TransactionState.SUBMITTED).submittedAt(now).clearNextRetryAt(true).build();
        }

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), TransactionState.INITIATED, transition, updates);
        PayoutTransaction current = currentState(tx, applied);
        boolean success = !current.getState().isFailedTerminal();

        log.info("Payout submitted: externalPayoutId={}, state={}", payout.getId(), current.getState());
        return PayoutSubmissionResult.of(current, success,
                success ? null : ErrorCode.PROCESSOR_REJECTED,
                success ? null : current.getFailureDescription());
    }

    private PayoutSubmissionResult deferForRetry(PayoutTransaction tx, PayoutGatewayException e) {
        Instant now = clock.instant();
        StateTransition transition = StateTransition.builder()
                .from(TransactionState.INITIATED)
                .to(TransactionState.SUBMITTED)
                .timestamp(now)
                .source(TransitionSource.SYSTEM)
                .reason("Submission failed, scheduled for retry: " + e.getMessage())
                .build();
        TransactionFieldUpdates updates = TransactionFieldUpdates.builder()
                .retryCount(0)
                .nextRetryAt(now.plus(properties.getRetry().getInitialDelay()))
                .failureDescription(e.getMessage())
                .build();

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), TransactionState.INITIATED, transition, updates);
        PayoutTransaction current = currentState(tx, applied);

        log.warn("Payout submission deferred: nextRetryAt={}, error={}", current.getNextRetryAt(), e.getMessage());
        return PayoutSubmissionResult.of(current, false, ErrorCode.PROCESSOR_UNAVAILABLE,
                "Payout processor unavailable, submission will be retried: " + e.getMessage());
    }

    private PayoutSubmissionResult rejectPermanently(PayoutTransaction tx, PayoutGatewayException e) {
        StateTransition transition = StateTransition.of(TransactionState.INITIATED, TransactionState.FAILED,
                clock.instant(), TransitionSource.SYSTEM, "Processor rejected payout");
        TransactionFieldUpdates updates = TransactionFieldUpdates.builder()
                .failureReason(FailureReason.PAYOUT_REJECTED)
                .failureDescription(e.getMessage())
                .build();

        StoreResult<PayoutTransaction> applied = transactionStore.applyTransition(
                tx.getTransactionId(), TransactionState.INITIATED, transition, updates);
        PayoutTransaction current = currentState(tx, applied);

        log.warn("Payout rejected by processor: httpStatus={}, error={}", e.getHttpStatus(), e.getMessage());
        return PayoutSubmissionResult.of(current, false, ErrorCode.PROCESSOR_REJECTED, e.getMessage());
    }

    /**
     * The stored transaction after our write. On CONFLICT a webhook got there
     * first, so the fresh row is what the caller should see.
     */
    private PayoutTransaction currentState(PayoutTransaction tx, StoreResult<PayoutTransaction> applied) {
        if (applied.isOk()) {
            return applied.orElseThrow();
        }
        log.warn("Post-submission update not applied: result={}", applied);
        return transactionStore.getByTransactionId(tx.getTransactionId()).orElse(tx);
    }
}
