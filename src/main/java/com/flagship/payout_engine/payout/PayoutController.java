package com.flagship.payout_engine.payout;

import com.flagship.payout_engine.payout.dto.CreatePayoutRequest;
import com.flagship.payout_engine.payout.dto.PayoutListResponse;
import com.flagship.payout_engine.payout.dto.PayoutResponse;
import com.flagship.payout_engine.payout.exception.TransactionNotFoundException;
import com.flagship.payout_engine.transaction.PayoutMode;
import com.flagship.payout_engine.transaction.PayoutPurpose;
import com.flagship.payout_engine.transaction.TransactionQuery;
import com.flagship.payout_engine.transaction.TransactionQueryService;
import com.flagship.payout_engine.transaction.TransactionState;
import com.flagship.payout_engine.transaction.TransactionStats;
import com.flagship.payout_engine.transaction.TransactionType;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * REST API for payouts.
 *
 * - POST with an optional Idempotency-Key header; a replayed key returns the
 *   existing payout with 200 instead of 201
 * - A processor outage answers 202: the payout exists and will be retried
 * - Cancellation is scoped to the caller given in X-User-Id
 */
@RestController
@RequestMapping("/api/payouts")
@RequiredArgsConstructor
@Slf4j
public class PayoutController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String USER_ID_HEADER = "X-User-Id";

    private final PayoutSubmitter payoutSubmitter;
    private final PayoutCancellationService cancellationService;
    private final TransactionQueryService queryService;

    @PostMapping
    public ResponseEntity<PayoutSubmissionResult> createPayout(
            @Valid @RequestBody CreatePayoutRequest request,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey) {

        log.info("Received payout request: userId={}, amount={}, mode={}",
                request.userId(), request.amount(), request.mode());

        PayoutRequest payoutRequest = PayoutRequest.builder()
                .userId(request.userId())
                .fundAccountRef(request.fundAccountRef())
                .amount(request.amount())
                .mode(PayoutMode.fromValue(request.mode()))
                .purpose(PayoutPurpose.fromValue(request.purpose()))
                .type(request.type() != null ? TransactionType.fromValue(request.type()) : TransactionType.TRANSFER)
                .narration(request.narration())
                .metadata(request.metadata())
                .clientNonce(idempotencyKey)
                .build();

        PayoutSubmissionResult result = payoutSubmitter.initiate(payoutRequest);
        return ResponseEntity.status(statusFor(result)).body(result);
    }

    @GetMapping("/{transactionId}")
    public ResponseEntity<PayoutResponse> getPayout(@PathVariable("transactionId") String transactionId) {
        return queryService.findById(transactionId)
                .map(tx -> ResponseEntity.ok(PayoutResponse.withHistory(tx)))
                .orElseThrow(() -> new TransactionNotFoundException(transactionId));
    }

    @GetMapping
    public ResponseEntity<PayoutListResponse> listPayouts(
            @RequestParam(value = "user_id", required = false) String userId,
            @RequestParam(value = "state", required = false) List<String> states,
            @RequestParam(value = "type", required = false) String type,
            @RequestParam(value = "mode", required = false) String mode,
            @RequestParam(value = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
            @RequestParam(value = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
            @RequestParam(value = "min_amount", required = false) Long minAmount,
            @RequestParam(value = "max_amount", required = false) Long maxAmount,
            @RequestParam(value = "limit", required = false) Integer limit,
            @RequestParam(value = "offset", required = false) Integer offset,
            @RequestParam(value = "sort", defaultValue = "created_at") String sort,
            @RequestParam(value = "order", defaultValue = "desc") String order) {

        TransactionQuery query = TransactionQuery.builder()
                .userId(userId)
                .states(parseStates(states))
                .type(type != null ? TransactionType.fromValue(type) : null)
                .mode(mode != null ? PayoutMode.fromValue(mode) : null)
                .createdFrom(from)
                .createdTo(to)
                .minAmount(minAmount)
                .maxAmount(maxAmount)
                .limit(limit)
                .offset(offset)
                .sortBy(parseSort(sort))
                .ascending("asc".equalsIgnoreCase(order))
                .build();

        return ResponseEntity.ok(PayoutListResponse.from(queryService.list(query)));
    }

    @PostMapping("/{transactionId}/cancel")
    public ResponseEntity<CancellationResult> cancelPayout(
            @PathVariable("transactionId") String transactionId,
            @RequestHeader(USER_ID_HEADER) String userId) {

        CancellationResult result = cancellationService.cancel(transactionId, userId);
        if (result.isSuccess()) {
            return ResponseEntity.ok(result);
        }
        HttpStatus status = switch (result.getErrorCode()) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NOT_CANCELLABLE, CONFLICT -> HttpStatus.CONFLICT;
            case PROCESSOR_REFUSED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PROCESSOR_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(result);
    }

    @GetMapping("/stats")
    public ResponseEntity<TransactionStats> getStats(@RequestParam("user_id") String userId) {
        return ResponseEntity.ok(queryService.statsForUser(userId));
    }

    private static HttpStatus statusFor(PayoutSubmissionResult result) {
        if (result.isSuccess()) {
            return result.isDuplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        }
        if (result.isDuplicate()) {
            return HttpStatus.OK;
        }
        return switch (result.getErrorCode()) {
            case INVALID_REQUEST, INVALID_AMOUNT -> HttpStatus.BAD_REQUEST;
            case FUND_ACCOUNT_NOT_FOUND -> HttpStatus.NOT_FOUND;
            case FUND_ACCOUNT_INACTIVE, FUND_ACCOUNT_NOT_OWNED, PROCESSOR_REJECTED -> HttpStatus.UNPROCESSABLE_ENTITY;
            case PROCESSOR_UNAVAILABLE -> HttpStatus.ACCEPTED;
            case CONFLICT -> HttpStatus.CONFLICT;
        };
    }

    private static Set<TransactionState> parseStates(List<String> states) {
        if (states == null || states.isEmpty()) {
            return null;
        }
        Set<TransactionState> parsed = EnumSet.noneOf(TransactionState.class);
        states.forEach(s -> parsed.add(TransactionState.fromValue(s)));
        return parsed;
    }

    private static TransactionQuery.SortField parseSort(String sort) {
        return switch (sort.toLowerCase()) {
            case "created_at", "createdat" -> TransactionQuery.SortField.CREATED_AT;
            case "amount" -> TransactionQuery.SortField.AMOUNT;
            case "state" -> TransactionQuery.SortField.STATE;
            default -> throw new IllegalArgumentException("Unsupported sort field: " + sort);
        };
    }
}
