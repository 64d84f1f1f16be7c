package com.flagship.payout_engine.payout;

import com.flagship.payout_engine.transaction.PayoutMode;
import com.flagship.payout_engine.transaction.PayoutPurpose;
import com.flagship.payout_engine.transaction.TransactionType;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Input to {@link PayoutSubmitter#initiate(PayoutRequest)}.
 * amount is in paise. clientNonce is optional.
 */
@Value
@Builder
public class PayoutRequest {
    String userId;
    String fundAccountRef;
    long amount;
    PayoutMode mode;
    PayoutPurpose purpose;
    @Builder.Default
    TransactionType type = TransactionType.TRANSFER;
    String narration;
    Map<String, String> metadata;
    String clientNonce;
}
