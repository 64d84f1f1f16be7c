package com.flagship.payout_engine.webhook;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payout_engine.processor.RazorpayPayoutGateway.PayoutEntity;

import java.util.List;

/**
 * Webhook envelope as sent by the processor:
 * {@code {entity, account_id, event, contains, payload: {payout: {entity: {...}}}, created_at}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PayoutWebhookEvent(
        @JsonProperty("entity") String entity,
        @JsonProperty("account_id") String accountId,
        @JsonProperty("event") String event,
        @JsonProperty("contains") List<String> contains,
        @JsonProperty("payload") Payload payload,
        @JsonProperty("created_at") long createdAt) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Payload(@JsonProperty("payout") Wrapper payout) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Wrapper(@JsonProperty("entity") PayoutEntity entity) {}

    /**
     * The payout entity, or null when the event carries none.
     */
    public PayoutEntity payoutEntity() {
        return payload != null && payload.payout() != null ? payload.payout().entity() : null;
    }

    public String payoutId() {
        PayoutEntity payout = payoutEntity();
        return payout != null ? payout.id() : null;
    }
}
